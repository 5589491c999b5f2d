package com.flagship.collective_finance.paymentmethod;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Random claim codes for virtual cards. Ambiguous characters (0/O, 1/I) are
 * left out since codes are typed in by hand.
 */
@Component
public class ClaimCodeGenerator {

    static final int CODE_LENGTH = 8;
    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();

    private final SecureRandom random = new SecureRandom();

    public String next() {
        char[] code = new char[CODE_LENGTH];
        for (int i = 0; i < CODE_LENGTH; i++) {
            code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(code);
    }
}

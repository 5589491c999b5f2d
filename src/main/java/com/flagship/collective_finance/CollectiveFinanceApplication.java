package com.flagship.collective_finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollectiveFinanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectiveFinanceApplication.class, args);
    }
}

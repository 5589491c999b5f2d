package com.flagship.collective_finance.account;

import com.flagship.collective_finance.account.dto.CreateUserRequest;
import com.flagship.collective_finance.account.dto.CreateUserResponse;
import com.flagship.collective_finance.auth.Principal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final AccountService accountService;

    /**
     * Signs up a user, optionally together with an organization they administer.
     */
    @PostMapping
    public ResponseEntity<CreateUserResponse> createUser(@Valid @RequestBody CreateUserRequest request,
                                                         Principal principal) {
        CreateUserResult result = accountService.createUser(CreateUserCommand.builder()
                .email(request.getEmail())
                .name(request.getName())
                .organizationName(request.getOrganizationName())
                .organizationWebsite(request.getOrganizationWebsite())
                .build(), principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(CreateUserResponse.from(result));
    }
}

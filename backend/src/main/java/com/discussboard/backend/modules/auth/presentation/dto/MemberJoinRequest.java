package com.discussboard.backend.modules.auth.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record MemberJoinRequest(
        @NotBlank(message = "email is required") @Email @Size(max = 320) String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "nickname is required") @Size(max = 64) String nickname,
        @NotEmpty(message = "consent is required") List<@Valid ConsentRequest> consent
) {
}

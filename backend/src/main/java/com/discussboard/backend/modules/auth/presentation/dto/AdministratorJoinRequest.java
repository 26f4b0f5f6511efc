package com.discussboard.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AdministratorJoinRequest(
        @NotBlank(message = "email is required") @Email @Size(max = 320) String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "nickname is required") @Size(max = 64) String nickname
) {
}

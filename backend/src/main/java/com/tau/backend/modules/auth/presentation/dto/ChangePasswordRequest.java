package com.tau.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "currentPassword is required") String currentPassword,
        @NotBlank(message = "newPassword is required")
        @Size(min = 8, max = 256, message = "newPassword must be 8-256 characters") String newPassword
) {

    @Override
    public String toString() {
        return "ChangePasswordRequest[****]";
    }
}

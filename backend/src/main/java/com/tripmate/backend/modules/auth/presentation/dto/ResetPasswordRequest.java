package com.tripmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "token is required") String token,
        @NotBlank(message = "newPassword is required") @Size(min = 8, max = 128, message = "newPassword must be 8-128 characters") String newPassword
) {
}

package com.tripmate.backend.modules.auth.presentation.dto;

public record AuthResponse(UserResponse user, TokenPairResponse tokens) {
}

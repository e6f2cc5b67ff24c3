package com.tripmate.backend.modules.auth.presentation.dto;

/**
 * Without a refresh token every session of the user is ended.
 */
public record LogoutRequest(String refreshToken) {
}

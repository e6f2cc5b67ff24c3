package com.tripmate.backend.modules.auth.presentation;

import com.tripmate.backend.global.security.SecurityUtils;
import com.tripmate.backend.global.web.ApiResponse;
import com.tripmate.backend.global.web.ClientIpResolver;
import com.tripmate.backend.modules.auth.application.AuthService;
import com.tripmate.backend.modules.auth.application.CredentialRecoveryService;
import com.tripmate.backend.modules.auth.application.SessionContext;
import com.tripmate.backend.modules.auth.presentation.dto.AuthResponse;
import com.tripmate.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tripmate.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.tripmate.backend.modules.auth.presentation.dto.LoginRequest;
import com.tripmate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.tripmate.backend.modules.auth.presentation.dto.RefreshTokenRequest;
import com.tripmate.backend.modules.auth.presentation.dto.RefreshTokenResponse;
import com.tripmate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.tripmate.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.tripmate.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.tripmate.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "Registration, login and session lifecycle")
public class AuthController {

    private final AuthService authService;
    private final CredentialRecoveryService credentialRecoveryService;

    public AuthController(AuthService authService, CredentialRecoveryService credentialRecoveryService) {
        this.authService = authService;
        this.credentialRecoveryService = credentialRecoveryService;
    }

    @PostMapping("/register")
    @Operation(summary = "Create an account and start a session")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Registered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Email already in use")
    })
    public ResponseEntity<ApiResponse<AuthResponse>> register(
            @Valid @RequestBody RegisterRequest request,
            HttpServletRequest httpRequest
    ) {
        AuthResponse response = authService.register(request, sessionContext(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("User registered successfully", response));
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange credentials for a token pair")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Logged in"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Invalid email or password")
    })
    public ResponseEntity<ApiResponse<AuthResponse>> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(ApiResponse.ok("Login successful", authService.login(request, sessionContext(httpRequest))));
    }

    @PostMapping("/refresh-token")
    @Operation(summary = "Issue a new access token; the refresh token is returned unchanged")
    public ResponseEntity<ApiResponse<RefreshTokenResponse>> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(ApiResponse.ok("Token refreshed successfully", authService.refresh(request.refreshToken())));
    }

    @PostMapping("/logout")
    @Operation(summary = "End one session, or all sessions when no refresh token is given")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> logout(@RequestBody(required = false) LogoutRequest request) {
        authService.logout(SecurityUtils.getCurrentPrincipal(), SecurityUtils.getCurrentAccessToken(), request);
        return ResponseEntity.ok(ApiResponse.ok("Logged out successfully"));
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change password and revoke every session")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<Void>> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(SecurityUtils.getCurrentPrincipal(), SecurityUtils.getCurrentAccessToken(), request);
        return ResponseEntity.ok(ApiResponse.ok("Password changed successfully. Please log in again."));
    }

    @PostMapping("/forgot-password")
    @Operation(summary = "Request a password reset token")
    public ResponseEntity<ApiResponse<Void>> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(credentialRecoveryService.forgotPassword(request.email())));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Set a new password with a reset token")
    public ResponseEntity<ApiResponse<Void>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        credentialRecoveryService.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.ok(ApiResponse.ok("Password reset successfully"));
    }

    @GetMapping("/verify-email/{token}")
    @Operation(summary = "Confirm an email address")
    public ResponseEntity<ApiResponse<Void>> verifyEmail(@PathVariable String token) {
        credentialRecoveryService.verifyEmail(token);
        return ResponseEntity.ok(ApiResponse.ok("Email verified successfully"));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Send a new email verification token")
    public ResponseEntity<ApiResponse<Void>> resendVerification(@Valid @RequestBody ResendVerificationRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(credentialRecoveryService.resendVerification(request.email())));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<ApiResponse<UserResponse>> me() {
        return ResponseEntity.ok(ApiResponse.ok("Current user", authService.me(SecurityUtils.getCurrentPrincipal())));
    }

    private static SessionContext sessionContext(HttpServletRequest request) {
        return new SessionContext(request.getHeader(HttpHeaders.USER_AGENT), ClientIpResolver.resolve(request));
    }
}

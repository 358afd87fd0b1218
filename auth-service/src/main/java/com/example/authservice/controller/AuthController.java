package com.example.authservice.controller;

import com.example.authservice.config.OpenApiConfig;
import com.example.authservice.dto.*;
import com.example.authservice.entity.User;
import com.example.authservice.security.AccessTokenClaims;
import com.example.authservice.security.SecurityContextHelper;
import com.example.authservice.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication controller.
 * Thin HTTP layer over AuthService; the caller's identity comes from the verified access token.
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = OpenApiConfig.AUTH_TAG)
public class AuthController {

    private final AuthService authService;
    private final SecurityContextHelper securityContextHelper;

    public AuthController(AuthService authService, SecurityContextHelper securityContextHelper) {
        this.authService = authService;
        this.securityContextHelper = securityContextHelper;
    }

    /**
     * UC-REGISTER: User Registration
     *
     * POST /api/auth/register
     *
     * @param request RegisterRequest with email, password, confirmPassword, displayName
     * @return 201 Created with AuthResponse (user info + tokens)
     */
    @PostMapping("/register")
    @Operation(summary = "Register a new account")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        var result = authService.register(
                request.email(), request.password(), request.confirmPassword(), request.displayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.of(result));
    }

    /**
     * UC-LOGIN: User Login
     *
     * POST /api/auth/login
     *
     * @return 200 OK with AuthResponse, 401 for any credential failure
     */
    @PostMapping("/login")
    @Operation(summary = "Sign in with email and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(AuthResponse.of(authService.login(request.email(), request.password())));
    }

    /**
     * UC-REFRESH-TOKEN: Refresh Access Token
     *
     * POST /api/auth/refresh
     *
     * The presented refresh token is consumed; the response carries its replacement.
     */
    @PostMapping("/refresh")
    @Operation(summary = "Exchange a refresh token for a new token pair")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(AuthResponse.of(authService.refresh(request.refreshToken())));
    }

    /**
     * UC-LOGOUT: User Logout
     *
     * POST /api/auth/logout
     */
    @PostMapping("/logout")
    @Operation(summary = "Revoke the current session", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<MessageResponse> logout(@RequestBody(required = false) LogoutRequest request) {
        AccessTokenClaims caller = securityContextHelper.requireCurrentClaims();
        authService.logout(caller, request != null ? request.refreshToken() : null);
        return ResponseEntity.ok(MessageResponse.of("Logged out successfully"));
    }

    @PostMapping("/logout-all")
    @Operation(summary = "Revoke every session of the current user",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<RevocationResponse> logoutAll() {
        AccessTokenClaims caller = securityContextHelper.requireCurrentClaims();
        int revoked = authService.logoutAll(caller.identityId());
        return ResponseEntity.ok(new RevocationResponse("All sessions revoked", revoked));
    }

    @GetMapping("/me")
    @Operation(summary = "Get the current user", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<UserResponse> me() {
        AccessTokenClaims caller = securityContextHelper.requireCurrentClaims();
        return ResponseEntity.ok(UserResponse.of(authService.getCurrentUser(caller.identityId())));
    }

    @PutMapping("/profile")
    @Operation(summary = "Update display name and avatar",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<UserResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        AccessTokenClaims caller = securityContextHelper.requireCurrentClaims();
        User user = authService.updateProfile(caller.identityId(), request.displayName(), request.avatarRef());
        return ResponseEntity.ok(UserResponse.of(user));
    }

    @PutMapping("/change-password")
    @Operation(summary = "Change password", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        AccessTokenClaims caller = securityContextHelper.requireCurrentClaims();
        authService.changePassword(caller.identityId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.ok(MessageResponse.of("Password changed successfully"));
    }
}

package com.openforge.setlist.auth;

import com.openforge.setlist.auth.dto.AccountResponse;
import com.openforge.setlist.auth.dto.LoginRequest;
import com.openforge.setlist.auth.dto.RefreshRequest;
import com.openforge.setlist.auth.dto.RegisterRequest;
import com.openforge.setlist.auth.dto.RegistrationResponse;
import com.openforge.setlist.auth.dto.TokenResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints:
 *   POST /api/auth/register         : create account (+ artist profile), 201
 *   POST /api/auth/login            : username or email + password
 *   POST /api/auth/refresh          : rotate a refresh token into a new pair
 *   POST /api/auth/logout           : revoke the presented access token
 *   GET  /api/auth/me               : current account, artist fields merged
 *   POST /api/auth/me/deactivate    : soft-deactivate the current account
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final RegistrationService registrationService;
    private final AuthService         authService;

    @PostMapping("/register")
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.register(request));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request);
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal AccountPrincipal principal) {
        authService.logout(principal);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public AccountResponse me(@AuthenticationPrincipal AccountPrincipal principal) {
        return authService.currentAccount(principal);
    }

    @PostMapping("/me/deactivate")
    public ResponseEntity<Void> deactivate(@AuthenticationPrincipal AccountPrincipal principal) {
        authService.deactivate(principal);
        return ResponseEntity.noContent().build();
    }
}

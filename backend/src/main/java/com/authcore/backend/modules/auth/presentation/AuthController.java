package com.authcore.backend.modules.auth.presentation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.global.security.JwtAuthenticationPrincipal;
import com.authcore.backend.global.security.SecurityUtils;
import com.authcore.backend.global.web.ClientAddressResolver;
import com.authcore.backend.modules.auth.application.AuthResult;
import com.authcore.backend.modules.auth.application.AuthService;
import com.authcore.backend.modules.auth.application.ClientMetadata;
import com.authcore.backend.modules.auth.presentation.dto.AuthResponse;
import com.authcore.backend.modules.auth.presentation.dto.LoginRequest;
import com.authcore.backend.modules.auth.presentation.dto.MessageResponse;
import com.authcore.backend.modules.auth.presentation.dto.RegisterRequest;
import com.authcore.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;
    private final RefreshTokenCookies refreshTokenCookies;
    private final ClientAddressResolver clientAddressResolver;

    public AuthController(
            AuthService authService,
            RefreshTokenCookies refreshTokenCookies,
            ClientAddressResolver clientAddressResolver
    ) {
        this.authService = authService;
        this.refreshTokenCookies = refreshTokenCookies;
        this.clientAddressResolver = clientAddressResolver;
    }

    @Operation(summary = "Register a new user", description = "Creates the account and signs it in")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered; refresh token set as cookie"),
            @ApiResponse(responseCode = "400", description = "`invalid_input`: email or password rule violated"),
            @ApiResponse(responseCode = "409", description = "`conflict`: email already registered"),
            @ApiResponse(responseCode = "429", description = "`rate_limited`")
    })
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request,
                                                 HttpServletRequest httpRequest) {
        AuthResult result = authService.register(request.email(), request.password(), metadata(httpRequest));
        return withRefreshCookie(ResponseEntity.status(HttpStatus.CREATED), result);
    }

    @Operation(summary = "Log in with email and password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated; refresh token set as cookie"),
            @ApiResponse(responseCode = "401", description = "`unauthorized`: same response for every credential failure"),
            @ApiResponse(responseCode = "429", description = "`rate_limited`")
    })
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request,
                                              HttpServletRequest httpRequest) {
        AuthResult result = authService.login(request.email(), request.password(), metadata(httpRequest));
        return withRefreshCookie(ResponseEntity.ok(), result);
    }

    @Operation(
            summary = "Rotate the refresh token",
            description = """
                    Consumes the refresh token from the cookie and issues a new pair. \
                    A consumed token is rejected on every later attempt.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated; new refresh token set as cookie"),
            @ApiResponse(responseCode = "400", description = "`invalid_input`: no refresh cookie"),
            @ApiResponse(responseCode = "401", description = "`unauthorized`: invalid, expired or already used token"),
            @ApiResponse(responseCode = "429", description = "`rate_limited`")
    })
    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(
            @CookieValue(name = "${auth.cookie.name:refresh_token}", required = false) String refreshToken,
            HttpServletRequest httpRequest
    ) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ProblemException(ErrorCategory.INVALID_INPUT, "refresh token not found in cookie");
        }
        AuthResult result = authService.refresh(refreshToken, metadata(httpRequest));
        return withRefreshCookie(ResponseEntity.ok(), result);
    }

    @Operation(
            summary = "Log out",
            description = "Revokes the refresh token from the cookie when it belongs to the caller and clears the cookie"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged out; repeated calls also succeed"),
            @ApiResponse(responseCode = "401", description = "`unauthorized`: missing or invalid access token"),
            @ApiResponse(responseCode = "503", description = "`unavailable`: token store unreachable")
    })
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = "${auth.cookie.name:refresh_token}", required = false) String refreshToken
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        authService.logout(principal.userId(), refreshToken);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, refreshTokenCookies.clear().toString())
                .body(new MessageResponse("logged out successfully"));
    }

    @Operation(summary = "Current user profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile of the access token's subject"),
            @ApiResponse(responseCode = "401", description = "`unauthorized`: missing or invalid access token, or user removed")
    })
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(UserProfileResponse.from(authService.getProfile(SecurityUtils.getCurrentUserId())));
    }

    private ResponseEntity<AuthResponse> withRefreshCookie(ResponseEntity.BodyBuilder builder, AuthResult result) {
        return builder
                .header(HttpHeaders.SET_COOKIE,
                        refreshTokenCookies.issue(result.refreshToken(), result.refreshExpiresIn()).toString())
                .body(AuthResponse.from(result));
    }

    private ClientMetadata metadata(HttpServletRequest request) {
        return new ClientMetadata(request.getHeader(HttpHeaders.USER_AGENT), clientAddressResolver.resolve(request));
    }
}

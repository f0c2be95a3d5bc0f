package dustin.miniauth.domains.auth.controller;

import java.time.Clock;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.auth.middleware.CredentialMaterial;
import dustin.miniauth.domains.auth.model.SessionTokens;
import dustin.miniauth.domains.auth.model.dto.LoginRequest;
import dustin.miniauth.domains.auth.model.dto.LoginResponse;
import dustin.miniauth.domains.auth.model.dto.LogoutRequest;
import dustin.miniauth.domains.auth.model.dto.RefreshTokenRequest;
import dustin.miniauth.domains.auth.model.dto.RegisterRequest;
import dustin.miniauth.domains.auth.model.dto.UserResponse;
import dustin.miniauth.domains.auth.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 플랫폼 인증 컨트롤러
 * Platform Auth Controller
 * 토큰은 httpOnly 쿠키(access_token, refresh_token)로 주고받는다
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Platform user authentication")
public class AuthController {
    
    private final AuthService authService;
    private final SessionCookies sessionCookies;
    private final Clock clock;
    
    /**
     * 회원가입
     * Register
     */
    @Operation(
            summary = "플랫폼 회원가입",
            description = "새로운 플랫폼 사용자 계정을 생성합니다"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "User created successfully",
                    content = @Content(schema = @Schema(implementation = UserResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Validation failed or weak password"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserResponse.from(authService.registerPlatformUser(request)));
    }
    
    /**
     * 로그인
     * Login
     */
    @Operation(
            summary = "플랫폼 로그인",
            description = "이메일과 비밀번호로 로그인합니다. Access Token 과 Refresh Token 은 쿠키로 설정됩니다"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Login successful",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Invalid email or password")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest,
                                               HttpServletResponse httpResponse) {
        SessionTokens tokens = authService.loginPlatform(request, httpRequest.getHeader(HttpHeaders.USER_AGENT));
        sessionCookies.write(httpResponse, tokens, clock.instant());
        return ResponseEntity.ok(LoginResponse.of(tokens, "Login successful"));
    }
    
    /**
     * 토큰 갱신
     * Refresh tokens (rotation)
     */
    @Operation(
            summary = "토큰 갱신",
            description = "refresh_token 쿠키(또는 본문)로 새 토큰 쌍을 발급받습니다. 사용된 Refresh Token 은 폐기됩니다"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token refreshed successfully"),
            @ApiResponse(responseCode = "401", description = "Invalid, revoked or expired refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@RequestBody(required = false) RefreshTokenRequest request,
                                                 HttpServletRequest httpRequest,
                                                 HttpServletResponse httpResponse) {
        String refreshToken = refreshTokenOf(httpRequest, request == null ? null : request.getRefreshToken());
        SessionTokens tokens = authService.refresh(refreshToken, null, httpRequest.getHeader(HttpHeaders.USER_AGENT));
        sessionCookies.write(httpResponse, tokens, clock.instant());
        return ResponseEntity.ok(LoginResponse.of(tokens, "Token refreshed"));
    }
    
    /**
     * 로그아웃
     * Logout; always succeeds and clears the session cookies
     */
    @Operation(summary = "로그아웃", description = "Refresh Token 을 무효화하고 쿠키를 삭제합니다")
    @ApiResponse(responseCode = "200", description = "Logout successful")
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(@RequestBody(required = false) LogoutRequest request,
                                                      HttpServletRequest httpRequest,
                                                      HttpServletResponse httpResponse) {
        authService.logout(refreshTokenOf(httpRequest, request == null ? null : request.getRefreshToken()), null);
        sessionCookies.clear(httpResponse);
        return ResponseEntity.ok(Map.of("message", "Logout successful"));
    }
    
    /**
     * 모든 기기에서 로그아웃
     * Logout everywhere
     */
    @Operation(
            summary = "전체 로그아웃",
            description = "현재 사용자의 모든 Refresh Token 을 폐기합니다",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "All sessions revoked"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/logout-all")
    public ResponseEntity<Map<String, Object>> logoutAll(HttpServletRequest httpRequest,
                                                         HttpServletResponse httpResponse) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireUser(httpRequest);
        int revoked = authService.logoutAll(principal.getUserId());
        sessionCookies.clear(httpResponse);
        return ResponseEntity.ok(Map.of("message", "Logged out from all sessions", "revokedSessions", revoked));
    }
    
    private static String refreshTokenOf(HttpServletRequest request, String fromBody) {
        if (fromBody != null && !fromBody.isBlank()) {
            return fromBody;
        }
        return CredentialMaterial.cookieValue(request, CredentialMaterial.REFRESH_TOKEN_COOKIE);
    }
}

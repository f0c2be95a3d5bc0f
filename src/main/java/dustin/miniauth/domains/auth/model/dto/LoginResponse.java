package dustin.miniauth.domains.auth.model.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import dustin.miniauth.domains.auth.model.SessionTokens;
import dustin.miniauth.domains.auth.model.TokenTransport;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 로그인 / 토큰 갱신 응답 DTO
 * Login and refresh response
 *
 * 플랫폼 흐름에서는 토큰이 쿠키로 전달되므로 accessToken / refreshToken 이 비어 있다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "로그인 응답")
public class LoginResponse {
    
    @Schema(description = "사용자 정보 (비밀번호 제외)")
    private UserResponse user;
    
    @Schema(description = "JWT Access Token (클라이언트 흐름에서만)", example = "eyJhbGciOiJIUzI1NiJ9...")
    private String accessToken;
    
    @Schema(description = "Refresh Token (클라이언트 흐름에서만)", example = "q0sN3m7...")
    private String refreshToken;
    
    @Schema(description = "토큰 타입", example = "bearer")
    private String tokenType;
    
    @Schema(description = "Access Token 만료 시각")
    private Instant accessTokenExpiresAt;
    
    @Schema(description = "Refresh Token 만료 시각")
    private Instant refreshTokenExpiresAt;
    
    @Schema(description = "성공 메시지", example = "Login successful")
    private String message;
    
    /**
     * 전달 방식이 BODY 일 때만 토큰 값을 포함한다
     * Token values are included only for body transport
     */
    public static LoginResponse of(SessionTokens tokens, String message) {
        boolean inBody = tokens.getTransport() == TokenTransport.BODY;
        return LoginResponse.builder()
                .user(UserResponse.from(tokens.getUser()))
                .accessToken(inBody ? tokens.getAccessToken() : null)
                .refreshToken(inBody ? tokens.getRefreshToken() : null)
                .tokenType(inBody ? "bearer" : null)
                .accessTokenExpiresAt(tokens.getAccessTokenExpiresAt())
                .refreshTokenExpiresAt(tokens.getRefreshTokenExpiresAt())
                .message(message)
                .build();
    }
}

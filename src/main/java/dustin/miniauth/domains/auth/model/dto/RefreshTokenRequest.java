package dustin.miniauth.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 토큰 갱신 요청 DTO
 * Refresh Token Request DTO
 * 플랫폼 흐름에서는 생략 가능 (refresh_token 쿠키 사용)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "토큰 갱신 요청")
public class RefreshTokenRequest {
    
    @Schema(description = "Refresh Token", example = "q0sN3m7...")
    private String refreshToken;
}

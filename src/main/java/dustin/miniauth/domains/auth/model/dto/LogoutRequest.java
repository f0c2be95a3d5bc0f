package dustin.miniauth.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 로그아웃 요청 DTO
 * Logout Request DTO (token optional; logout always succeeds)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "로그아웃 요청")
public class LogoutRequest {
    
    @Schema(description = "무효화할 Refresh Token", example = "q0sN3m7...")
    private String refreshToken;
}

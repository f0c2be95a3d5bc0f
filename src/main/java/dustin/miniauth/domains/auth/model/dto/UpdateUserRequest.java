package dustin.miniauth.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로필 수정 요청 DTO (null 인 필드는 변경하지 않음)
 * Update profile request; null fields are left unchanged
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로필 수정 요청")
public class UpdateUserRequest {
    
    @Schema(description = "새 이메일 주소", example = "new@example.com")
    @Email(message = "유효한 이메일 형식이 아닙니다")
    @Size(max = 255)
    private String email;
    
    @Schema(description = "새 이름", example = "Jane Doe")
    @Size(max = 100)
    private String fullName;
}

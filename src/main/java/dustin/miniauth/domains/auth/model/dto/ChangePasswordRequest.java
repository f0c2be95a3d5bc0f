package dustin.miniauth.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 비밀번호 변경 요청 DTO
 * Change Password Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "비밀번호 변경 요청")
public class ChangePasswordRequest {
    
    @Schema(description = "현재 비밀번호", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "현재 비밀번호는 필수입니다")
    private String currentPassword;
    
    @Schema(description = "새 비밀번호", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "새 비밀번호는 필수입니다")
    @Size(max = 128)
    private String newPassword;
    
    @Schema(description = "새 비밀번호 확인", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "새 비밀번호 확인은 필수입니다")
    private String confirmPassword;
}

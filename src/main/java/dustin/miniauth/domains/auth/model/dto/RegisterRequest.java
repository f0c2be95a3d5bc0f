package dustin.miniauth.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 회원가입 요청 DTO
 * Register Request DTO (platform and client)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "회원가입 요청")
public class RegisterRequest {
    
    @Schema(description = "이메일 주소", example = "user@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "이메일은 필수입니다")
    @Email(message = "유효한 이메일 형식이 아닙니다")
    @Size(max = 255)
    private String email;
    
    @Schema(description = "비밀번호 (8자 이상, 대/소문자, 숫자, 특수문자 포함)", example = "Secret123!", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "비밀번호는 필수입니다")
    @Size(max = 128)
    private String password;
    
    @Schema(description = "비밀번호 확인", example = "Secret123!", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "비밀번호 확인은 필수입니다")
    private String confirmPassword;
    
    @Schema(description = "이름", example = "Jane Doe")
    @Size(max = 100)
    private String fullName;
}

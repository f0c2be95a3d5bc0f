package dustin.miniauth.domains.project.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * API 키 생성 요청 DTO
 * Create API Key Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "API 키 생성 요청")
public class CreateApiKeyRequest {
    
    @Schema(description = "키 이름", example = "iOS app", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "키 이름은 필수입니다")
    @Size(max = 50)
    private String name;
}

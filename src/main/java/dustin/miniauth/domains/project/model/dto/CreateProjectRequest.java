package dustin.miniauth.domains.project.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 생성 요청 DTO
 * Create Project Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로젝트 생성 요청")
public class CreateProjectRequest {
    
    @Schema(description = "프로젝트 이름", example = "My App", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "프로젝트 이름은 필수입니다")
    @Size(max = 50)
    private String name;
    
    @Schema(description = "설명", example = "Customer facing mobile app")
    @Size(max = 200)
    private String description;
}

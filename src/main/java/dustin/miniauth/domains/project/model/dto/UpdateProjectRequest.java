package dustin.miniauth.domains.project.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 수정 요청 DTO (null 인 필드는 변경하지 않음)
 * Update Project Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로젝트 수정 요청")
public class UpdateProjectRequest {
    
    @Schema(description = "프로젝트 이름", example = "My App")
    @Size(min = 1, max = 50)
    private String name;
    
    @Schema(description = "설명")
    @Size(max = 200)
    private String description;
}

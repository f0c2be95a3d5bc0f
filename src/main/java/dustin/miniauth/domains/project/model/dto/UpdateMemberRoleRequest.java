package dustin.miniauth.domains.project.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 멤버 역할 변경 요청 DTO
 * Update Member Role Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "멤버 역할 변경 요청")
public class UpdateMemberRoleRequest {
    
    @Schema(description = "새 역할", example = "admin", allowableValues = {"member", "admin"})
    @NotBlank(message = "역할은 필수입니다")
    private String role;
}

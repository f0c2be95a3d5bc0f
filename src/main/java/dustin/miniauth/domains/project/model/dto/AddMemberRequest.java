package dustin.miniauth.domains.project.model.dto;

import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 멤버 추가 요청 DTO
 * Add Member Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "멤버 추가 요청")
public class AddMemberRequest {
    
    @Schema(description = "추가할 플랫폼 사용자 ID", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "사용자 ID는 필수입니다")
    private UUID userId;
    
    @Schema(description = "역할", example = "member", allowableValues = {"member", "admin"})
    @NotBlank(message = "역할은 필수입니다")
    private String role;
}

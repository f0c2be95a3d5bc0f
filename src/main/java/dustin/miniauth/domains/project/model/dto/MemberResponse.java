package dustin.miniauth.domains.project.model.dto;

import java.time.Instant;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 멤버 응답 DTO
 * Project Member Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로젝트 멤버")
public class MemberResponse {
    private UUID userId;
    private String email;
    private String fullName;
    
    @Schema(description = "역할", example = "member", allowableValues = {"owner", "admin", "member"})
    private String role;
    
    @Schema(description = "합류 시각 (소유자는 프로젝트 생성 시각)")
    private Instant joinedAt;
}

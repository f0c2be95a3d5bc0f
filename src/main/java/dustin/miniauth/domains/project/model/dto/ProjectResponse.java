package dustin.miniauth.domains.project.model.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import dustin.miniauth.domains.project.model.entity.Project;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 응답 DTO
 * Project Response DTO
 * apiKeys 는 소유자에게만 채워진다
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "프로젝트")
public class ProjectResponse {
    private UUID id;
    private String name;
    private String description;
    private UUID ownerId;
    
    @Schema(description = "호출자의 역할", example = "owner")
    private String role;
    
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
    
    @Schema(description = "API 키 목록 (소유자만)")
    private List<ApiKeyResponse> apiKeys;
    
    public static ProjectResponse from(Project project, String role) {
        return ProjectResponse.builder()
                .id(project.getId())
                .name(project.getName())
                .description(project.getDescription())
                .ownerId(project.getOwnerId())
                .role(role)
                .active(project.getActive())
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }
}

package dustin.miniauth.domains.project.model.dto;

import java.util.UUID;

import dustin.miniauth.domains.project.model.entity.Project;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 사용자에게 보이는 프로젝트 요약
 * Public project summary for a project end-user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로젝트 요약 (클라이언트용)")
public class ClientProjectResponse {
    private UUID id;
    private String name;
    private String description;
    
    public static ClientProjectResponse from(Project project) {
        return new ClientProjectResponse(project.getId(), project.getName(), project.getDescription());
    }
}

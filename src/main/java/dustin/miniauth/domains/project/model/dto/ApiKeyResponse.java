package dustin.miniauth.domains.project.model.dto;

import java.time.Instant;
import java.util.UUID;

import dustin.miniauth.domains.project.model.entity.ProjectApiKey;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * API 키 응답 DTO
 * Project API Key Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로젝트 API 키")
public class ApiKeyResponse {
    @Schema(description = "키 ID")
    private UUID id;
    
    @Schema(description = "프로젝트 ID")
    private UUID projectId;
    
    @Schema(description = "API 키 값", example = "ma_1718000000_Xy3...")
    private String key;
    
    @Schema(description = "키 이름", example = "Default")
    private String name;
    
    @Schema(description = "활성 여부")
    private Boolean active;
    
    @Schema(description = "마지막 사용 시각")
    private Instant lastUsedAt;
    
    @Schema(description = "생성 시각")
    private Instant createdAt;
    
    public static ApiKeyResponse from(ProjectApiKey key) {
        return ApiKeyResponse.builder()
                .id(key.getId())
                .projectId(key.getProjectId())
                .key(key.getKeyValue())
                .name(key.getName())
                .active(key.getActive())
                .lastUsedAt(key.getLastUsedAt())
                .createdAt(key.getCreatedAt())
                .build();
    }
}

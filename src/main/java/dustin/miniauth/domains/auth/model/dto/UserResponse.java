package dustin.miniauth.domains.auth.model.dto;

import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import dustin.miniauth.domains.auth.model.entity.User;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용자 응답 DTO (비밀번호 제외)
 * User Response DTO (without password)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "사용자 정보 응답 (비밀번호 제외)")
public class UserResponse {
    @Schema(description = "사용자 ID")
    private UUID id;
    
    @Schema(description = "이메일 주소", example = "user@example.com")
    private String email;
    
    @Schema(description = "이름", example = "Jane Doe")
    private String fullName;
    
    @Schema(description = "소속 프로젝트 ID (플랫폼 사용자는 없음)")
    private UUID projectId;
    
    @Schema(description = "활성 여부")
    private Boolean active;
    
    @Schema(description = "계정 생성 시간")
    private Instant createdAt;
    
    @Schema(description = "계정 정보 수정 시간")
    private Instant updatedAt;
    
    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .projectId(user.getProjectId())
                .active(user.getActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}

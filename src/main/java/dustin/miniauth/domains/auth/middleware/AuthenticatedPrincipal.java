package dustin.miniauth.domains.auth.middleware;

import java.util.UUID;

import dustin.miniauth.domains.auth.model.TokenScope;
import lombok.Builder;
import lombok.Value;

/**
 * 요청에 부착되는 인증 주체
 * Principal attached to a request after authentication
 *
 * - 플랫폼 사용자: userId, scope = platform
 * - 프로젝트 사용자: userId, projectId, scope = project:<id>
 * - API 키: apiKeyId, projectId, scope = project:<id> (userId 없음)
 */
@Value
@Builder
public class AuthenticatedPrincipal {
    UUID userId;
    String email;
    UUID projectId;
    UUID apiKeyId;
    TokenScope scope;
}

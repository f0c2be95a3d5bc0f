package dustin.miniauth.domains.auth.model;

import java.util.Optional;
import java.util.UUID;

import lombok.EqualsAndHashCode;

/**
 * 토큰 스코프 (테넌트 컨텍스트)
 * Token scope: {@code platform} or {@code project:<projectId>}
 */
@EqualsAndHashCode
public final class TokenScope {

    private static final String PLATFORM_CLAIM = "platform";
    private static final String PROJECT_PREFIX = "project:";

    private static final TokenScope PLATFORM = new TokenScope(null);

    private final UUID projectId;

    private TokenScope(UUID projectId) {
        this.projectId = projectId;
    }

    public static TokenScope platform() {
        return PLATFORM;
    }

    public static TokenScope project(UUID projectId) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId must not be null for a project scope");
        }
        return new TokenScope(projectId);
    }

    /**
     * 사용자 소속으로부터 스코프 결정
     * Scope a user's credentials are minted for
     */
    public static TokenScope forProjectId(UUID projectIdOrNull) {
        return projectIdOrNull == null ? PLATFORM : project(projectIdOrNull);
    }

    /**
     * scope 클레임 파싱. 형식이 맞지 않으면 empty.
     * Parse a scope claim; empty when malformed.
     */
    public static Optional<TokenScope> parse(String claim) {
        if (claim == null) {
            return Optional.empty();
        }
        if (PLATFORM_CLAIM.equals(claim)) {
            return Optional.of(PLATFORM);
        }
        if (claim.startsWith(PROJECT_PREFIX)) {
            try {
                return Optional.of(project(UUID.fromString(claim.substring(PROJECT_PREFIX.length()))));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean isPlatform() {
        return projectId == null;
    }

    /**
     * @return 프로젝트 ID (플랫폼 스코프면 null)
     */
    public UUID getProjectId() {
        return projectId;
    }

    public String toClaim() {
        return isPlatform() ? PLATFORM_CLAIM : PROJECT_PREFIX + projectId;
    }

    @Override
    public String toString() {
        return toClaim();
    }
}

package dustin.miniauth.domains.project.model.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * 프로젝트 내 역할
 * Project role. OWNER is implicit (Project.ownerId) and never stored as a member row.
 */
public enum ProjectRole {
    OWNER,
    ADMIN,
    MEMBER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 멤버 행에 할당 가능한 역할 파싱 ("member" | "admin")
     * Parse an assignable member role; OWNER is never assignable.
     */
    public static Optional<ProjectRole> assignable(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "member":
                return Optional.of(MEMBER);
            case "admin":
                return Optional.of(ADMIN);
            default:
                return Optional.empty();
        }
    }
}

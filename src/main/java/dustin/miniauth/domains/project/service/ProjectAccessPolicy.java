package dustin.miniauth.domains.project.service;

import java.util.Optional;
import java.util.UUID;

import dustin.miniauth.domains.auth.exception.AuthorizationDeniedException;
import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectMember;
import dustin.miniauth.domains.project.model.entity.ProjectRole;

/**
 * 프로젝트 접근 정책 (상태 없는 순수 함수)
 * Project access rules, evaluated per request over freshly loaded rows
 *
 * - 소유자도 멤버도 아닌 사용자에게 프로젝트는 존재하지 않는 것처럼 보인다 (NotFound)
 * - 수정/삭제, 키 관리, 멤버 관리는 소유자만 (AuthorizationDenied)
 * - 소유자는 멤버 작업의 대상이 될 수 없다 (AuthorizationDenied)
 */
public final class ProjectAccessPolicy {

    private ProjectAccessPolicy() {
    }

    /**
     * 사용자의 프로젝트 내 역할
     * Caller's role in the project, empty when unrelated
     */
    public static Optional<ProjectRole> roleOf(Project project, UUID userId, Optional<ProjectMember> membership) {
        if (project.isOwnedBy(userId)) {
            return Optional.of(ProjectRole.OWNER);
        }
        return membership
                .filter(m -> m.getUserId().equals(userId) && m.getProjectId().equals(project.getId()))
                .map(ProjectMember::getRole);
    }

    public static ProjectRole requireVisible(Project project, UUID userId, Optional<ProjectMember> membership) {
        return roleOf(project, userId, membership)
                .orElseThrow(() -> new ResourceNotFoundException("Project"));
    }

    public static void requireOwner(Project project, UUID userId) {
        if (!project.isOwnedBy(userId)) {
            throw new AuthorizationDeniedException("user " + userId + " is not the owner of project " + project.getId());
        }
    }

    public static void requireNotOwner(Project project, UUID targetUserId) {
        if (project.isOwnedBy(targetUserId)) {
            throw new AuthorizationDeniedException("the owner of project " + project.getId() + " cannot be modified as a member");
        }
    }

    /**
     * 프로젝트 사용자는 자기 프로젝트만 볼 수 있다
     * A project end-user only sees its own tenant; anything else is NotFound
     */
    public static void requireSameTenant(UUID principalProjectId, UUID projectId) {
        if (principalProjectId == null || !principalProjectId.equals(projectId)) {
            throw new ResourceNotFoundException("Project");
        }
    }
}

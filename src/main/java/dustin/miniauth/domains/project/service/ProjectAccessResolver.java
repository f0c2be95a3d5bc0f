package dustin.miniauth.domains.project.service;

import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectMember;
import dustin.miniauth.domains.project.model.entity.ProjectRole;
import dustin.miniauth.domains.project.repository.ProjectMemberRepository;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;

/**
 * 요청마다 프로젝트와 멤버십을 새로 읽어 접근 정책을 적용한다
 * Loads a project and the caller's membership, then applies ProjectAccessPolicy
 */
@Component
@RequiredArgsConstructor
public class ProjectAccessResolver {

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository projectMemberRepository;

    @Transactional(readOnly = true)
    public ProjectAccess requireVisible(UUID userId, UUID projectId) {
        Project project = projectRepository.findByIdAndActiveTrue(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project"));
        Optional<ProjectMember> membership = project.isOwnedBy(userId)
                ? Optional.empty()
                : projectMemberRepository.findByProjectIdAndUserId(projectId, userId);
        ProjectRole role = ProjectAccessPolicy.requireVisible(project, userId, membership);
        return new ProjectAccess(project, role);
    }

    @Transactional(readOnly = true)
    public Project requireOwned(UUID userId, UUID projectId) {
        ProjectAccess access = requireVisible(userId, projectId);
        ProjectAccessPolicy.requireOwner(access.getProject(), userId);
        return access.getProject();
    }
}

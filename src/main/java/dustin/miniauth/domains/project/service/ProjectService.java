package dustin.miniauth.domains.project.service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.project.model.dto.ApiKeyResponse;
import dustin.miniauth.domains.project.model.dto.ClientProjectResponse;
import dustin.miniauth.domains.project.model.dto.CreateProjectRequest;
import dustin.miniauth.domains.project.model.dto.ProjectResponse;
import dustin.miniauth.domains.project.model.dto.UpdateProjectRequest;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectApiKey;
import dustin.miniauth.domains.project.model.entity.ProjectMember;
import dustin.miniauth.domains.project.model.entity.ProjectRole;
import dustin.miniauth.domains.project.repository.ProjectApiKeyRepository;
import dustin.miniauth.domains.project.repository.ProjectMemberRepository;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import dustin.miniauth.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로젝트 서비스
 * Project Service
 *
 * 역할:
 * - 생성 (기본 API 키 "Default" 동시 발급)
 * - 목록 / 조회 (소유 또는 멤버인 활성 프로젝트만)
 * - 수정 / 삭제 (소유자만, 삭제는 soft delete)
 * - 프로젝트 사용자용 요약 조회 (자기 프로젝트만)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {
    
    static final int MAX_PAGE_SIZE = 100;
    
    private final ProjectRepository projectRepository;
    private final ProjectApiKeyRepository projectApiKeyRepository;
    private final ProjectMemberRepository projectMemberRepository;
    private final ProjectAccessResolver projectAccessResolver;
    private final ApiKeyService apiKeyService;
    
    /**
     * 프로젝트 생성
     * Create a project owned by the caller, together with its default API key
     */
    @Transactional
    public ProjectResponse createProject(UUID ownerId, CreateProjectRequest request) {
        Project project = Project.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .ownerId(ownerId)
                .active(true)
                .build();
        project = projectRepository.save(project);
        
        ProjectApiKey defaultKey = apiKeyService.createDefaultKey(project);
        log.info("User {} created project {}", ownerId, project.getId());
        
        ProjectResponse response = ProjectResponse.from(project, ProjectRole.OWNER.value());
        response.setApiKeys(List.of(ApiKeyResponse.from(defaultKey)));
        return response;
    }
    
    /**
     * 접근 가능한 프로젝트 목록
     * Projects the caller owns or belongs to
     */
    @Transactional(readOnly = true)
    public PageResponse<ProjectResponse> listProjects(UUID userId, int page, int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        Page<Project> projects = projectRepository.findAccessibleByUserId(userId, pageable);
        
        List<ProjectResponse> content = projects.getContent().stream()
                .map(project -> ProjectResponse.from(project, roleLabel(project, userId)))
                .collect(Collectors.toList());
        return PageResponse.of(projects, content);
    }
    
    @Transactional(readOnly = true)
    public ProjectResponse getProject(UUID userId, UUID projectId) {
        ProjectAccess access = projectAccessResolver.requireVisible(userId, projectId);
        ProjectResponse response = ProjectResponse.from(access.getProject(), access.getRole().value());
        if (access.isOwner()) {
            response.setApiKeys(projectApiKeyRepository.findByProjectIdOrderByCreatedAtAsc(projectId).stream()
                    .map(ApiKeyResponse::from)
                    .collect(Collectors.toList()));
        }
        return response;
    }
    
    @Transactional
    public ProjectResponse updateProject(UUID userId, UUID projectId, UpdateProjectRequest request) {
        Project project = projectAccessResolver.requireOwned(userId, projectId);
        if (request.getName() != null) {
            project.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            project.setDescription(request.getDescription());
        }
        project = projectRepository.save(project);
        return ProjectResponse.from(project, ProjectRole.OWNER.value());
    }
    
    /**
     * 프로젝트 삭제 (soft delete)
     * Deactivate the project and all of its keys, and drop its member rows
     */
    @Transactional
    public void deleteProject(UUID userId, UUID projectId) {
        Project project = projectAccessResolver.requireOwned(userId, projectId);
        project.setActive(false);
        projectRepository.saveAndFlush(project);
        
        int keys = projectApiKeyRepository.deactivateAllByProjectId(projectId);
        int members = projectMemberRepository.deleteAllByProjectId(projectId);
        log.info("User {} deleted project {} ({} key(s) deactivated, {} member(s) removed)",
                userId, projectId, keys, members);
    }
    
    /**
     * 프로젝트 사용자용 프로젝트 요약
     * Public summary of the caller's own project; other ids are NotFound
     */
    @Transactional(readOnly = true)
    public ClientProjectResponse getClientProject(UUID principalProjectId, UUID projectId) {
        ProjectAccessPolicy.requireSameTenant(principalProjectId, projectId);
        return projectRepository.findByIdAndActiveTrue(projectId)
                .map(ClientProjectResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Project"));
    }
    
    private String roleLabel(Project project, UUID userId) {
        if (project.isOwnedBy(userId)) {
            return ProjectRole.OWNER.value();
        }
        return projectMemberRepository.findByProjectIdAndUserId(project.getId(), userId)
                .map(ProjectMember::getRole)
                .map(ProjectRole::value)
                .orElse(null);
    }
}

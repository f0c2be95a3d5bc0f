package dustin.miniauth.domains.project.service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectApiKey;
import dustin.miniauth.domains.project.repository.ProjectApiKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로젝트 API 키 관리 서비스
 * Project API key management (owner only)
 *
 * 비활성화는 soft delete 이며 되돌릴 수 없다. 이미 발급된 세션에는 영향이 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {
    
    static final String DEFAULT_KEY_NAME = "Default";
    
    private final ProjectApiKeyRepository projectApiKeyRepository;
    private final ProjectAccessResolver projectAccessResolver;
    private final Clock clock;
    
    @Transactional
    public ProjectApiKey createKey(UUID userId, UUID projectId, String name) {
        Project project = projectAccessResolver.requireOwned(userId, projectId);
        return issueKey(project, name);
    }
    
    /**
     * 프로젝트 생성 시 기본 키 발급
     * Issue the default key of a newly created project
     */
    @Transactional
    public ProjectApiKey createDefaultKey(Project project) {
        return issueKey(project, DEFAULT_KEY_NAME);
    }
    
    @Transactional(readOnly = true)
    public List<ProjectApiKey> listKeys(UUID userId, UUID projectId, boolean includeInactive) {
        projectAccessResolver.requireOwned(userId, projectId);
        return includeInactive
                ? projectApiKeyRepository.findByProjectIdOrderByCreatedAtAsc(projectId)
                : projectApiKeyRepository.findByProjectIdAndActiveTrueOrderByCreatedAtAsc(projectId);
    }
    
    /**
     * 키 비활성화 (멱등)
     * Deactivate a key; deactivating an inactive key is a no-op
     */
    @Transactional
    public ProjectApiKey deactivateKey(UUID userId, UUID projectId, UUID keyId) {
        projectAccessResolver.requireOwned(userId, projectId);
        ProjectApiKey key = projectApiKeyRepository.findByIdAndProjectId(keyId, projectId)
                .orElseThrow(() -> new ResourceNotFoundException("API key"));
        
        if (Boolean.TRUE.equals(key.getActive())) {
            key.setActive(false);
            key = projectApiKeyRepository.save(key);
            log.info("Deactivated API key {} of project {}", keyId, projectId);
        }
        return key;
    }
    
    private ProjectApiKey issueKey(Project project, String name) {
        ProjectApiKey key = ProjectApiKey.builder()
                .projectId(project.getId())
                .keyValue(ApiKeyGenerator.generate(clock.instant()))
                .name(name)
                .active(true)
                .build();
        key = projectApiKeyRepository.save(key);
        log.info("Created API key {} ({}) for project {}", key.getId(), name, project.getId());
        return key;
    }
}

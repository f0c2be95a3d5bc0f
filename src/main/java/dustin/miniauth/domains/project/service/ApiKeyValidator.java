package dustin.miniauth.domains.project.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectApiKey;
import dustin.miniauth.domains.project.repository.ProjectApiKeyRepository;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * API 키 검증 서비스
 * API Key Validator - resolves a project API key to its project
 *
 * 키가 없는 경우와 비활성인 경우를 구분하지 않는다 (열거 공격 방지).
 * 성공 시 last_used_at 을 비동기로 갱신하며, 그 실패는 요청을 실패시키지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyValidator {

    private final ProjectApiKeyRepository projectApiKeyRepository;
    private final ProjectRepository projectRepository;
    private final ApiKeyUsageRecorder apiKeyUsageRecorder;
    private final Clock clock;

    /**
     * API 키 검증
     * Validate a key; empty when unknown, inactive, or its project is inactive
     */
    @Transactional(readOnly = true)
    public Optional<ValidatedApiKey> validate(String keyValue) {
        if (!ApiKeyGenerator.hasValidFormat(keyValue)) {
            return Optional.empty();
        }

        Optional<ProjectApiKey> key = projectApiKeyRepository.findByKeyValue(keyValue)
                .filter(k -> Boolean.TRUE.equals(k.getActive()));
        if (key.isEmpty()) {
            return Optional.empty();
        }

        Optional<Project> project = projectRepository.findByIdAndActiveTrue(key.get().getProjectId());
        if (project.isEmpty()) {
            return Optional.empty();
        }

        recordUsage(key.get());
        return Optional.of(new ValidatedApiKey(key.get().getId(), project.get()));
    }

    private void recordUsage(ProjectApiKey key) {
        Instant now = Instant.now(clock);
        try {
            apiKeyUsageRecorder.recordUsage(key.getId(), now);
        } catch (TaskRejectedException e) {
            log.warn("Skipped usage recording for API key {}: executor saturated", key.getId());
        }
    }
}

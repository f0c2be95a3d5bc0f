package dustin.miniauth.domains.project.service;

import java.time.Instant;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import dustin.miniauth.domains.project.repository.ProjectApiKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * API 키 사용 기록기
 * Records last_used_at for API keys off the request path (best-effort)
 *
 * 트랜잭션은 Repository 의 update 한 건에만 걸린다. 실패가 비동기 스레드 밖으로 새지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyUsageRecorder {

    private final ProjectApiKeyRepository projectApiKeyRepository;

    @Async("apiKeyUsageExecutor")
    public void recordUsage(UUID keyId, Instant usedAt) {
        try {
            projectApiKeyRepository.updateLastUsed(keyId, usedAt);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to record usage of API key {}: {}", keyId, e.getMessage());
        }
    }
}

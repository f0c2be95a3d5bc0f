package dustin.miniauth.domains.project.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.project.model.entity.ProjectApiKey;

/**
 * 프로젝트 API 키 Repository
 * Project API Key Repository
 */
@Repository
public interface ProjectApiKeyRepository extends JpaRepository<ProjectApiKey, UUID> {
    
    /**
     * 키 값으로 정확히 일치하는 API 키 조회
     * Find API key by exact key value
     */
    Optional<ProjectApiKey> findByKeyValue(String keyValue);
    
    Optional<ProjectApiKey> findByIdAndProjectId(UUID id, UUID projectId);
    
    List<ProjectApiKey> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
    
    List<ProjectApiKey> findByProjectIdAndActiveTrueOrderByCreatedAtAsc(UUID projectId);
    
    /**
     * 마지막 사용 시각 갱신
     * Update last used timestamp
     */
    @Transactional
    @Modifying
    @Query("UPDATE ProjectApiKey k SET k.lastUsedAt = :usedAt WHERE k.id = :keyId")
    int updateLastUsed(@Param("keyId") UUID keyId, @Param("usedAt") Instant usedAt);
    
    /**
     * 프로젝트의 모든 키 비활성화 (프로젝트 삭제 시)
     * Deactivate all keys of a project
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProjectApiKey k SET k.active = false WHERE k.projectId = :projectId AND k.active = true")
    int deactivateAllByProjectId(@Param("projectId") UUID projectId);
}

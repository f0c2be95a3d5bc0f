package dustin.miniauth.domains.auth.repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.miniauth.domains.auth.model.entity.RefreshToken;

/**
 * Refresh Token Repository
 * Refresh Token Repository
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {
    
    /**
     * 토큰 해시로 Refresh Token 조회
     * Find refresh token by token hash
     */
    Optional<RefreshToken> findByTokenHash(String tokenHash);
    
    /**
     * 아직 폐기되지 않은 토큰 하나를 폐기 (compare-and-set)
     * Revoke a single token if it is still active
     *
     * @return 1 이면 이번 호출이 폐기함, 0 이면 이미 폐기된 상태
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.lastUsedAt = :now, rt.updatedAt = :now " +
           "WHERE rt.id = :tokenId AND rt.revoked = false")
    int revokeIfActive(@Param("tokenId") UUID tokenId, @Param("now") Instant now);
    
    /**
     * 사용자의 모든 Refresh Token 무효화
     * Revoke all refresh tokens for a user (single atomic statement)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.updatedAt = :now WHERE rt.userId = :userId AND rt.revoked = false")
    int revokeAllByUserId(@Param("userId") UUID userId, @Param("now") Instant now);
    
    /**
     * 사용자의 유효한 Refresh Token 개수 조회
     * Count valid refresh tokens for a user
     */
    @Query("SELECT COUNT(rt) FROM RefreshToken rt WHERE rt.userId = :userId AND rt.revoked = false AND rt.expiresAt > :now")
    long countValidByUserId(@Param("userId") UUID userId, @Param("now") Instant now);
}

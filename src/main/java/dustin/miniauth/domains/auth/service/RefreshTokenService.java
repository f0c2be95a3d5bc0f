package dustin.miniauth.domains.auth.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.config.AuthProperties;
import dustin.miniauth.domains.auth.model.IssuedRefreshToken;
import dustin.miniauth.domains.auth.model.entity.RefreshToken;
import dustin.miniauth.domains.auth.repository.RefreshTokenRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 서비스
 * Refresh Token Service - stateful, revocable refresh tokens
 *
 * 역할:
 * - 발급: 랜덤 값 생성 → 해시 저장 → 원본 값 반환
 * - 검증: 해시로 조회, 폐기/만료 여부 확인 (만료 행은 읽을 때 걸러냄)
 * - 폐기: revoked 플래그 설정 (멱등)
 */
@Slf4j
@Service
public class RefreshTokenService {
    
    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtService jwtService;
    private final Duration refreshTokenTtl;
    
    public RefreshTokenService(RefreshTokenRepository refreshTokenRepository,
                               JwtService jwtService,
                               AuthProperties properties) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.jwtService = jwtService;
        this.refreshTokenTtl = properties.getRefreshTokenTtl();
    }
    
    /**
     * Refresh Token 생성 및 DB 저장
     * Create and store refresh token
     *
     * 호출자의 트랜잭션 안에서 flush 까지 마쳐, 커밋되지 않은 토큰 값이
     * 밖으로 나가지 않도록 한다.
     */
    @Transactional
    public IssuedRefreshToken issueRefreshToken(UUID userId, String userAgent, Instant now) {
        String value = jwtService.generateRefreshToken();
        
        RefreshToken token = RefreshToken.builder()
                .userId(userId)
                .tokenHash(jwtService.hashRefreshToken(value))
                .expiresAt(now.plus(refreshTokenTtl))
                .userAgent(truncate(userAgent, 255))
                .revoked(false)
                .build();
        
        RefreshToken saved = refreshTokenRepository.saveAndFlush(token);
        return new IssuedRefreshToken(value, saved);
    }
    
    /**
     * Refresh Token 검증
     * Validate refresh token: empty when unknown, revoked or expired
     */
    @Transactional(readOnly = true)
    public Optional<RefreshToken> validateRefreshToken(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return refreshTokenRepository.findByTokenHash(jwtService.hashRefreshToken(value))
                .filter(token -> token.isUsableAt(now));
    }
    
    /**
     * 토큰 값으로 기록 조회 (상태 무관)
     * Look up a record by value regardless of its state
     */
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return refreshTokenRepository.findByTokenHash(jwtService.hashRefreshToken(value));
    }
    
    /**
     * 단일 토큰 폐기 (이미 폐기된 토큰이면 아무것도 하지 않음)
     * Revoke one token; idempotent
     *
     * @return 이번 호출로 폐기되었으면 true
     */
    @Transactional
    public boolean revoke(RefreshToken token, Instant now) {
        return refreshTokenRepository.revokeIfActive(token.getId(), now) == 1;
    }
    
    /**
     * 사용자의 모든 Refresh Token 폐기
     * Revoke every non-revoked refresh token of the user in one statement
     */
    @Transactional
    public int revokeAll(UUID userId, Instant now) {
        int revoked = refreshTokenRepository.revokeAllByUserId(userId, now);
        log.info("Revoked {} refresh token(s) for user {}", revoked, userId);
        return revoked;
    }
    
    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

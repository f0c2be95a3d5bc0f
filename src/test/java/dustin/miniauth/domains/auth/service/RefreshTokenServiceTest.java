package dustin.miniauth.domains.auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.config.TestConfig;
import dustin.miniauth.domains.auth.model.IssuedRefreshToken;
import dustin.miniauth.domains.auth.model.entity.RefreshToken;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.RefreshTokenRepository;
import dustin.miniauth.domains.auth.repository.UserRepository;

/**
 * Refresh Token 서비스 테스트
 * Refresh Token Service Test
 *
 * 테스트 항목:
 * 1. 발급 시 원본 값은 저장되지 않고 해시만 저장
 * 2. 만료 시각 이후 검증 실패
 * 3. revoke / revokeAll 후 만료 전이라도 검증 실패, 재폐기는 no-op
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class RefreshTokenServiceTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private RefreshTokenService refreshTokenService;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private UserRepository userRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        User user = userRepository.save(User.builder()
                .email("refresh-" + UUID.randomUUID() + "@test.com")
                .passwordHash("hash")
                .build());
        userId = user.getId();
    }

    @Test
    @DisplayName("원본 값은 응답에만 있고 DB 에는 해시만 저장")
    void storesOnlyHash() {
        IssuedRefreshToken issued = refreshTokenService.issueRefreshToken(userId, "JUnit", NOW);

        RefreshToken stored = refreshTokenRepository.findById(issued.getRecord().getId()).orElseThrow();
        assertThat(stored.getTokenHash()).hasSize(64).isNotEqualTo(issued.getValue());
        assertThat(stored.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(stored.getRevoked()).isFalse();
        assertThat(refreshTokenService.validateRefreshToken(issued.getValue(), NOW)).isPresent();
    }

    @Test
    @DisplayName("만료 시각부터는 검증 실패")
    void expiredTokenFails() {
        IssuedRefreshToken issued = refreshTokenService.issueRefreshToken(userId, null, NOW);
        Instant expiresAt = issued.getRecord().getExpiresAt();

        assertThat(refreshTokenService.validateRefreshToken(issued.getValue(), expiresAt.minusSeconds(1))).isPresent();
        assertThat(refreshTokenService.validateRefreshToken(issued.getValue(), expiresAt)).isEmpty();
    }

    @Test
    @DisplayName("revoke 한 토큰은 만료 전이라도 다시 검증되지 않고, 재폐기는 no-op")
    void revokedTokenNeverValidates() {
        IssuedRefreshToken issued = refreshTokenService.issueRefreshToken(userId, null, NOW);

        assertThat(refreshTokenService.revoke(issued.getRecord(), NOW)).isTrue();
        assertThat(refreshTokenService.revoke(issued.getRecord(), NOW)).isFalse();

        assertThat(refreshTokenService.validateRefreshToken(issued.getValue(), NOW)).isEmpty();
        assertThat(refreshTokenService.validateRefreshToken(issued.getValue(), NOW.plusSeconds(60))).isEmpty();
        assertThat(refreshTokenService.findByValue(issued.getValue())).get()
                .extracting(RefreshToken::getRevoked).isEqualTo(true);
    }

    @Test
    @DisplayName("revokeAll 은 그 사용자의 활성 토큰만 모두 폐기")
    void revokeAllOnlyTouchesOwner() {
        IssuedRefreshToken first = refreshTokenService.issueRefreshToken(userId, null, NOW);
        IssuedRefreshToken second = refreshTokenService.issueRefreshToken(userId, null, NOW);
        User other = userRepository.save(User.builder()
                .email("other-" + UUID.randomUUID() + "@test.com")
                .passwordHash("hash")
                .build());
        IssuedRefreshToken foreign = refreshTokenService.issueRefreshToken(other.getId(), null, NOW);

        assertThat(refreshTokenService.revokeAll(userId, NOW)).isEqualTo(2);
        assertThat(refreshTokenService.revokeAll(userId, NOW)).isZero();

        assertThat(refreshTokenService.validateRefreshToken(first.getValue(), NOW)).isEmpty();
        assertThat(refreshTokenService.validateRefreshToken(second.getValue(), NOW)).isEmpty();
        assertThat(refreshTokenService.validateRefreshToken(foreign.getValue(), NOW)).isPresent();
        assertThat(refreshTokenRepository.countValidByUserId(userId, NOW)).isZero();
    }

    @Test
    @DisplayName("알 수 없는 값은 empty")
    void unknownValue() {
        assertThat(refreshTokenService.validateRefreshToken("does-not-exist", NOW)).isEmpty();
        assertThat(refreshTokenService.validateRefreshToken(null, NOW)).isEmpty();
        assertThat(refreshTokenService.findByValue(" ")).isEmpty();
    }
}

package dustin.miniauth.integration;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.miniauth.config.MutableClock;
import dustin.miniauth.config.TestConfig;
import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.model.SessionTokens;
import dustin.miniauth.domains.auth.model.dto.LoginRequest;
import dustin.miniauth.domains.auth.model.dto.RegisterRequest;
import dustin.miniauth.domains.auth.repository.RefreshTokenRepository;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.auth.service.AuthService;
import dustin.miniauth.domains.auth.service.RefreshTokenService;

/**
 * 세션 동시성 통합 테스트
 * Session Concurrency Test
 *
 * 테스트 항목:
 * 1. 같은 Refresh Token 을 동시에 갱신하면 정확히 하나만 성공 (회전 재사용 방지)
 * 2. 로그인과 전체 로그아웃이 경합해도 결과는 사용자 행 잠금 순서와 일치
 *
 * 스레드마다 별도 트랜잭션이 필요하므로 테스트 트랜잭션 없이 실행하고 전후로 테이블을 비운다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class SessionConcurrencyTest {

    private static final String EMAIL = "race@x.com";
    private static final String PASSWORD = "Secret123!";
    private static final int THREADS = 8;

    @Autowired
    private AuthService authService;

    @Autowired
    private RefreshTokenService refreshTokenService;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private MutableClock clock;

    private ExecutorService executor;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        cleanUp();
        executor = Executors.newFixedThreadPool(THREADS);
        userId = authService.registerPlatformUser(RegisterRequest.builder()
                .email(EMAIL)
                .password(PASSWORD)
                .confirmPassword(PASSWORD)
                .build()).getId();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
        cleanUp();
    }

    private void cleanUp() {
        refreshTokenRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("같은 Refresh Token 동시 갱신: 하나만 성공, 나머지는 AuthenticationFailed")
    void concurrentRefreshOfSameToken() throws Exception {
        String refreshValue = authService.loginPlatform(new LoginRequest(EMAIL, PASSWORD), null).getRefreshToken();

        List<Future<SessionTokens>> results = runTogether(THREADS, () -> authService.refresh(refreshValue, null, "JUnit"));

        int successes = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<SessionTokens> result : results) {
            try {
                assertThat(result.get(30, TimeUnit.SECONDS).getRefreshToken()).isNotEqualTo(refreshValue);
                successes++;
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }

        assertThat(successes).isEqualTo(1);
        assertThat(failures).hasSize(THREADS - 1)
                .allSatisfy(f -> assertThat(f).isInstanceOf(AuthenticationFailedException.class));
        assertThat(refreshTokenService.validateRefreshToken(refreshValue, clock.instant())).isEmpty();
        assertThat(refreshTokenRepository.countValidByUserId(userId, clock.instant())).isEqualTo(1);
    }

    @RepeatedTest(5)
    @DisplayName("로그인과 전체 로그아웃 경합: 살아남는 토큰은 잠금 순서와 일치")
    void loginRacingLogoutAll() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        Future<SessionTokens> login = executor.submit(() -> {
            start.await();
            return authService.loginPlatform(new LoginRequest(EMAIL, PASSWORD), null);
        });
        Future<Integer> logoutAll = executor.submit(() -> {
            start.await();
            return authService.logoutAll(userId);
        });
        start.countDown();

        SessionTokens session = login.get(30, TimeUnit.SECONDS);
        int revoked = logoutAll.get(30, TimeUnit.SECONDS);
        boolean survived = refreshTokenService.validateRefreshToken(session.getRefreshToken(), clock.instant()).isPresent();

        // 로그아웃이 먼저 잠금을 잡았으면 폐기할 토큰이 없고 로그인 토큰이 남는다.
        // 로그인이 먼저 커밋됐으면 그 토큰이 폐기된다.
        assertThat(revoked).isBetween(0, 1);
        assertThat(survived).isEqualTo(revoked == 0);
        assertThat(refreshTokenRepository.countValidByUserId(userId, clock.instant())).isEqualTo(survived ? 1 : 0);
    }

    private <T> List<Future<T>> runTogether(int count, Callable<T> action) throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(count);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(executor.submit(() -> {
                ready.countDown();
                start.await();
                return action.call();
            }));
        }
        assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
        start.countDown();
        return futures;
    }
}

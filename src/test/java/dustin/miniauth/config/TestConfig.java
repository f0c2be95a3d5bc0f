package dustin.miniauth.config;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 테스트용 설정 클래스
 * Test Configuration
 *
 * 역할:
 * - 시스템 시계 대신 테스트가 조작할 수 있는 MutableClock 을 주입
 */
@TestConfiguration
public class TestConfig {
    
    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(Instant.now().truncatedTo(ChronoUnit.SECONDS));
    }
}

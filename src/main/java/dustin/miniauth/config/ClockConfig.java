package dustin.miniauth.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 시계 설정
 * Clock Configuration
 * 모든 만료 비교는 이 Clock 기준으로 한다 (테스트에서 교체 가능)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

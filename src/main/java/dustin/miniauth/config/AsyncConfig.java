package dustin.miniauth.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 비동기 처리 설정
 * Async Configuration
 * 요청 경로 밖에서 처리해도 되는 부수 효과(API 키 사용 시각 기록 등)를 위한 스레드 풀
 */
@Configuration
@EnableAsync
public class AsyncConfig {
    
    /**
     * API 키 사용 기록용 스레드 풀
     * API key usage recording executor
     * 큐가 가득 차면 기록을 버린다 (best-effort)
     */
    @Bean(name = "apiKeyUsageExecutor")
    public Executor apiKeyUsageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("api-key-usage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}

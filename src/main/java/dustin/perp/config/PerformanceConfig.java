package dustin.perp.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 성능 설정
 * Performance Configuration
 * 매칭 경로 밖에서 실행되는 비동기 영속화용 스레드 풀
 */
@Configuration
public class PerformanceConfig {

    /**
     * 주문 영속화용 비동기 스레드 풀
     * Order persistence thread pool
     * 
     * 큐는 무제한, 호출 스레드에서는 절대 실행하지 않음 (주문 접수가 DB 지연에 묶이지 않도록)
     */
    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // CPU 코어 수에 맞춰 스레드 수 설정 (무제한 큐라 max 는 core 와 같음)
        int poolSize = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("persist-");
        // 작업 완료 후 트랜잭션 동기화 상태 정리
        executor.setTaskDecorator(runnable -> () -> {
            try {
                runnable.run();
            } finally {
                TransactionSynchronizationManager.clear();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}

package decentralabs.settlement.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared infrastructure beans for the settlement flow.
 */
@Configuration
public class SettlementConfig {

    public static final String DISPATCH_EXECUTOR = "settlementDispatchExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for the fire-and-forget target leg. Rejected tasks are left to the
     * reconciler, so the queue is bounded.
     */
    @Bean(name = DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor settlementDispatchExecutor(IntentProperties properties) {
        IntentProperties.Dispatch dispatch = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getCorePoolSize());
        executor.setMaxPoolSize(dispatch.getMaxPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("target-settlement-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}

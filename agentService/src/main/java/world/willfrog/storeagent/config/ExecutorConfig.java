package world.willfrog.storeagent.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    /**
     * Fans out independent (store, agent) runs of one scheduler tick.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentRunExecutor(StoreAgentProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getScheduler().getBatchConcurrency()));
    }

    /**
     * Executes auto-approved actions when dispatch mode is inline.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService actionDispatchExecutor(@Value("${store-agent.dispatch.inline-concurrency:4}") int concurrency) {
        return Executors.newFixedThreadPool(Math.max(1, concurrency));
    }

    /**
     * Carries blocking collaborator calls so they can be abandoned on timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService externalCallExecutor(@Value("${store-agent.timeouts.pool-size:16}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }
}

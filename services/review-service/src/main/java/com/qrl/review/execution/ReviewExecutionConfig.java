package com.qrl.review.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReviewExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService reviewSearchExecutor(@Value("${review.execution.search-pool-size:6}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService reviewBatchExecutor(@Value("${review.execution.batch-pool-size:10}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @Bean
    public BoundedBatchExecutor boundedBatchExecutor(@Qualifier("reviewBatchExecutor") ExecutorService executor) {
        return new BoundedBatchExecutor(executor);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}

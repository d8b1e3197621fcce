package com.purchasingpower.schemaembed.configuration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Embedding Executor Tests")
class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("A saturated pool runs work on the caller instead of rejecting it")
    void embeddingExecutor_callerRunsWhenSaturated() {
        // When
        executor = new AsyncConfig().embeddingExecutor();

        // Then
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("embedding-");
        assertThat(executor.getQueueCapacity()).isEqualTo(200);
    }
}

package com.example.baselinediff.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncConfigTest {

    private final AsyncConfig.MdcTaskDecorator decorator = new AsyncConfig.MdcTaskDecorator();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void decoratedTask_SeesCallerCorrelationId() throws InterruptedException {
        MDC.put("correlationId", "SCAN-1234abcd");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task = decorator.decorate(() -> seen.set(MDC.get("correlationId")));
        MDC.clear();

        Thread worker = new Thread(task);
        worker.start();
        worker.join();

        assertThat(seen.get()).isEqualTo("SCAN-1234abcd");
    }

    @Test
    void decoratedTask_ClearsContextAfterRun() {
        MDC.put("correlationId", "SCAN-1");
        Runnable task = decorator.decorate(() -> { });

        task.run();

        assertThat(MDC.get("correlationId")).isNull();
    }
}

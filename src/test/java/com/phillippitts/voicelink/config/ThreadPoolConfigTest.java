package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void clearThreadContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.connectionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(512);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("conn-");
            assertThat(executor.getThreadPoolExecutor().getQueue()).isInstanceOf(SynchronousQueue.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void maxPoolNeverBelowCore() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getConnection().setCorePoolSize(4);
        properties.getConnection().setMaxPoolSize(2);

        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).connectionExecutor();
        try {
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRejectWhenEveryThreadIsBusy() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getConnection().setCorePoolSize(1);
        properties.getConnection().setMaxPoolSize(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).connectionExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shutdownInterruptsRunningTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).connectionExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        executor.shutdown();

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void propagatesThreadContextToWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).connectionExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        try {
            ThreadContext.put("requestId", "r-1");
            executor.execute(() -> {
                seen.set(ThreadContext.get("requestId"));
                done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("r-1");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("connectionId", "caller");
        Runnable decorated = ThreadPoolConfig.propagateThreadContext(
                () -> ThreadContext.put("connectionId", "inside"));
        ThreadContext.clearAll();
        ThreadContext.put("connectionId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("connectionId")).isEqualTo("worker");
    }
}

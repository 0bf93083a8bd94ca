package uk.gegc.ergtracker.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Asynchronous processing setup. Outbound email is the only fire-and-forget work today,
 * so it gets a small dedicated pool that also serves as the default {@code @Async} executor.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.mail.core-pool-size:1}")
    private int mailCorePoolSize;

    @Value("${async.mail.max-pool-size:2}")
    private int mailMaxPoolSize;

    @Value("${async.mail.queue-capacity:100}")
    private int mailQueueCapacity;

    @Value("${async.mail.keep-alive-seconds:60}")
    private int mailKeepAliveSeconds;

    @Bean(name = "mailTaskExecutor")
    public Executor mailTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(mailCorePoolSize);
        executor.setMaxPoolSize(mailMaxPoolSize);
        executor.setQueueCapacity(mailQueueCapacity);
        executor.setKeepAliveSeconds(mailKeepAliveSeconds);
        executor.setThreadNamePrefix("mail-");

        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Mail Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                mailCorePoolSize, mailMaxPoolSize, mailQueueCapacity, mailKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return mailTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}()",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}

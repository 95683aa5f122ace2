package com.newswebsite.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor used to fan out outbound mail (contact form pairs, newsletter batches).
 *
 * <p>The request's Log4j2 ThreadContext is copied onto the worker so mail logs
 * keep the request id.
 */
@Configuration
public class MailExecutorConfig {

    @Bean(name = "mailExecutor")
    public ThreadPoolTaskExecutor mailExecutor(AppProperties appProperties) {
        AppProperties.MailExecutor props = appProperties.getMailExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.setTaskDecorator(MailExecutorConfig::withCallerContext);

        executor.initialize();
        return executor;
    }

    /**
     * Runs the task under the submitting thread's ThreadContext, then puts back whatever
     * context the running thread had. Under {@code CallerRunsPolicy} that thread is the
     * request thread itself.
     */
    static Runnable withCallerContext(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}

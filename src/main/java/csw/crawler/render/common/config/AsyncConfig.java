package csw.crawler.render.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "fetchExecutor")
    public Executor fetchExecutor(@Value("${render.fetch.concurrency:10}") int concurrency) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(100); // Queue up to 100 requests when all threads are busy
        executor.setThreadNamePrefix("fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy()); // Run in caller’s thread if queue is full
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Fetch executor started with {} threads", concurrency);
        return executor;
    }
}

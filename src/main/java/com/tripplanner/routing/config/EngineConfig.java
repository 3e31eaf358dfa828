package com.tripplanner.routing.config;

import com.tripplanner.routing.util.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class EngineConfig {

    public static final String BACKGROUND_EXECUTOR = "routingBackgroundExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SlidingWindowRateLimiter overpassRateLimiter(RoutingProperties properties, Clock clock) {
        RoutingProperties.Overpass overpass = properties.getOverpass();
        return new SlidingWindowRateLimiter(overpass.getRateLimit(),
                Duration.ofSeconds(overpass.getRateWindowSeconds()), clock);
    }

    /**
     * Persistent cache writes and advisory route scoring.
     */
    @Bean(name = BACKGROUND_EXECUTOR)
    public Executor routingBackgroundExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("routing-bg-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Background queue full, dropping task {}", task));
        executor.initialize();
        return executor;
    }
}

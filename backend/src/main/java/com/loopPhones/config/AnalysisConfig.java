package com.loopPhones.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Market-average jitter for the heuristic pricing engine. */
    @Bean
    public Random pricingRandom() {
        return new Random();
    }

    @Bean
    public Random gradingRandom() {
        return new Random();
    }

    /** Runs the independent analysis stages of one request in parallel. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(@Value("${analysis.executor-threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Analysis executor started with {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }
}

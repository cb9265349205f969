package com.example.healthrag;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // daemon pool for the read-only sub-queries of a context build
    @Bean(destroyMethod = "shutdown")
    public ExecutorService retrievalExecutor(RetrievalProperties properties) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getSearchThreads()), r -> {
            Thread t = new Thread(r, "retrieval-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

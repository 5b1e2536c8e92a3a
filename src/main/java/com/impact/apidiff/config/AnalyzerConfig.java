package com.impact.apidiff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.impact.apidiff.service.FileSelection;
import com.impact.apidiff.service.JGitRevisionContentProvider;
import com.impact.apidiff.service.RevisionContentProviderFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class AnalyzerConfig {

    /**
     * Bounded pool shared by per-file diffing and usage scanning.
     * Spring calls {@code shutdown()} on context close.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(AnalyzerProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        log.info("Creating analysis executor with {} worker thread(s).", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public RevisionContentProviderFactory revisionContentProviderFactory(FileSelection fileSelection) {
        return (repositoryPath, baseRef, headRef) ->
                JGitRevisionContentProvider.open(repositoryPath, baseRef, headRef, fileSelection);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }
}

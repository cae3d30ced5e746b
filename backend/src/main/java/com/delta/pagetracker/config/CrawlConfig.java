package com.delta.pagetracker.config;

import com.delta.pagetracker.crawl.embedding.DisabledEmbeddingClient;
import com.delta.pagetracker.crawl.embedding.EmbeddingClient;
import com.delta.pagetracker.crawl.embedding.HttpEmbeddingClient;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getScheduler().getPoolSize() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getScheduler().getPoolSize(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-run-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "crawlTriggerScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler crawlTriggerScheduler(CrawlerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("crawl-trigger-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public TextEncryptor credentialEncryptor(CrawlerProperties properties) {
        CrawlerProperties.Credentials credentials = properties.getCredentials();
        return Encryptors.delux(credentials.getEncryptionKey(), credentials.getSalt());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public EmbeddingClient embeddingClient(
        CrawlerProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        CrawlerProperties.Embedding embedding = properties.getEmbedding();
        if (!embedding.isEnabled()) {
            log.info("No embedding endpoint configured; document versions will be stored without vectors");
            return new DisabledEmbeddingClient();
        }
        return new HttpEmbeddingClient(
            httpClient,
            objectMapper,
            embedding.getEndpoint(),
            Duration.ofSeconds(embedding.getTimeoutSeconds())
        );
    }
}

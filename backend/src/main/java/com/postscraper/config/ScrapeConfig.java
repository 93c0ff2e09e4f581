package com.postscraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.postscraper.scrape.auth.CredentialResolver;
import com.postscraper.scrape.model.ToolCredentials;
import com.postscraper.scrape.normalize.PostNormalizer;
import com.postscraper.scrape.process.BirdToolClient;
import com.postscraper.scrape.process.ExecutableLocator;
import com.postscraper.scrape.process.ProcessInvoker;
import com.postscraper.scrape.process.SubprocessInvoker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScrapeConfig {

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrency());
    }

    // two pipe readers per running subprocess
    @Bean(name = "processStreamExecutor", destroyMethod = "shutdownNow")
    public ExecutorService processStreamExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessInvoker processInvoker(@Qualifier("processStreamExecutor") ExecutorService processStreamExecutor) {
        return new SubprocessInvoker(processStreamExecutor);
    }

    @Bean
    public CredentialResolver credentialResolver(ScraperProperties properties, ObjectMapper objectMapper) {
        return new CredentialResolver(properties.getAuth(), objectMapper);
    }

    @Bean
    public BirdToolClient birdToolClient(
        ScraperProperties properties,
        CredentialResolver credentialResolver,
        ProcessInvoker processInvoker
    ) {
        ToolCredentials credentials = credentialResolver.resolve();
        return new BirdToolClient(
            properties.getTool(),
            credentials,
            properties.getAuth().getProxyUrl(),
            processInvoker,
            new ExecutableLocator()
        );
    }

    @Bean
    public PostNormalizer postNormalizer(ObjectMapper objectMapper, Clock clock) {
        return new PostNormalizer(objectMapper, clock);
    }
}

package com.loantracker.config;

import com.loantracker.store.DocumentStore;
import com.loantracker.store.memory.InMemoryDocumentStore;
import com.loantracker.store.mongo.MongoDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Wires the document store and the clock.
 *
 * The store implementation is chosen by {@code loan-tracker.store.type}; MongoDB is
 * the default.
 */
@Configuration
@Slf4j
public class LoanTrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "loan-tracker.store.type", havingValue = "mongo", matchIfMissing = true)
    public DocumentStore mongoDocumentStore(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoDocumentStore(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "loan-tracker.store.type", havingValue = "memory")
    public DocumentStore inMemoryDocumentStore(LoanTrackerProperties properties, Clock clock) {
        log.warn("Using in-memory document store: records are lost on restart");
        return new InMemoryDocumentStore(properties.getStore().getDatabase(), clock);
    }
}

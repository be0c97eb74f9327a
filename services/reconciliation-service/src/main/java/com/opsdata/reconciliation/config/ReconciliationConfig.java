package com.opsdata.reconciliation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdata.reconciliation.client.DirectorySourceRowReader;
import com.opsdata.reconciliation.client.SourceRowReader;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class ReconciliationConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    TransactionTemplate unitTransactionTemplate(PlatformTransactionManager transactionManager, ReconciliationProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setTimeout(properties.getStoreTimeoutSeconds());
        return template;
    }

    @Bean
    SourceRowReader sourceRowReader(ReconciliationProperties properties, ObjectMapper objectMapper) {
        properties.requireComplete();
        return new DirectorySourceRowReader(properties, objectMapper);
    }
}

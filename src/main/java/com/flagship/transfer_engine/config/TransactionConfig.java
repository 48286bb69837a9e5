package com.flagship.transfer_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction boundary used by the transfer engine and the approval processor.
 *
 * Each Initiate or Decide call runs as exactly one READ_COMMITTED transaction.
 * Balance read-modify-write sequences are serialized by row locks taken inside it.
 */
@Configuration
public class TransactionConfig {

    @Bean
    public TransactionTemplate transferTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setName("transfer-engine");
        return template;
    }
}

package com.rfidsync.infrastructure.config;

import com.rfidsync.domain.model.ContactFieldMapping;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Beans compartidos por el pipeline de sincronización.
 */
@Configuration
@Slf4j
public class SyncConfig {

    @Bean
    public ContactFieldMapping contactFieldMapping(
            @Value("${wildapricot.tag-id-field:TagId}") String tagIdField,
            @Value("${wildapricot.training-field:SafetyTrainings}") String trainingField) {
        log.info("Campos del directorio: tag='{}', capacitaciones='{}'", tagIdField, trainingField);
        return ContactFieldMapping.builder()
                .tagIdField(tagIdField)
                .trainingField(trainingField)
                .build();
    }

    /**
     * Hilo único donde corren los ciclos disparados por el scheduler.
     */
    @Bean
    public ThreadPoolTaskExecutor syncCycleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("sync-cycle-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

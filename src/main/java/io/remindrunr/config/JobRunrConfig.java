package io.remindrunr.config;

import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.storage.InMemoryStorageProvider;
import org.jobrunr.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JobRunr configuration. Jobs live in memory only: the JSON schedule store is the
 * durable source and {@link io.remindrunr.cron.StartupRecovery} re-arms timers on boot.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);

    @Bean
    public StorageProvider storageProvider(JobMapper jobMapper) {
        var storageProvider = new InMemoryStorageProvider();
        storageProvider.setJobMapper(jobMapper);
        log.info("JobRunr in-memory storage configured");
        return storageProvider;
    }
}

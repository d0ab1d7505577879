package com.eyelevel.lotprocessor;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Lot Processor Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables the features the batch pipeline relies on:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.processing" properties to
 *     {@link LotProcessingConfig}.</li>
 *     <li>{@link EnableScheduling}: Drives the reconciliation, webhook delivery and retention loop.</li>
 *     <li>{@link EnableRetry}: Retries transient failures while submitting batches to the inference provider.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for the Spring Data JPA repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.lotprocessor.repository")
@EnableConfigurationProperties(value = LotProcessingConfig.class)
@EnableRetry
public class LotProcessorApplication {

    /**
     * Launches the application and logs key environment information once the context is up.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting LotProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(LotProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "LotProcessor"));
        log.info("  - Local:          http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Scheduler tick: {} ms", env.getProperty("app.scheduler.tick-interval-ms", "30000"));
        log.info("  - Profile(s):     {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}

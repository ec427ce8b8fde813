package com.simpla.comparison;

import com.simpla.comparison.processor.ComparisonProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import javax.annotation.PreDestroy;

/**
 * Spring Boot Application for the Comparison Guard REST API.
 */
@SpringBootApplication
public class ComparisonApplication {

    private static final Logger LOG = LoggerFactory.getLogger(ComparisonApplication.class);

    private ComparisonProcessor processor;

    /**
     * Configure ComparisonProcessor as a singleton bean
     */
    @Bean
    public ComparisonProcessor comparisonProcessor() {
        if (processor == null) {
            processor = new ComparisonProcessor();
        }
        return processor;
    }

    @PreDestroy
    public void onShutdown() {
        if (processor != null) {
            LOG.info("Shutting down ComparisonApplication (data directory {})",
                    processor.getLawTreeRepository().getDataDirectory());
        }
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ComparisonApplication.class);
        // Default port, overridable with server.port
        app.setDefaultProperties(java.util.Collections.singletonMap("server.port", "8092"));
        app.run(args);
    }
}

package com.docclassifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class DocumentClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentClassifierApplication.class, args);
    }

    /**
     * Background tasks: pending-job poller, lease reaper and retention cleanup.
     * Disabled with app.scheduling.enabled=false.
     */
    @EnableScheduling
    @ConditionalOnProperty(name = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}

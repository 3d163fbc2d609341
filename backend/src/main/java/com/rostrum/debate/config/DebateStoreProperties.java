package com.rostrum.debate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Durable debate store settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rostrum.store")
public class DebateStoreProperties {

    /**
     * {@code file} keeps snapshots on disk; {@code in_memory} keeps them for the life of the process.
     */
    private String mode = "file";

    private String directory = ".debate-store";
    private String quarantineDirectory = "quarantine";
    private String archiveDirectory = "archive";

    /**
     * Look up every stored snapshot once the application is ready so interrupted debates resume.
     */
    private boolean recoverOnStartup = true;

    private Write write = new Write();

    @Getter
    @Setter
    public static class Write {
        private int maxAttempts = 3;
        private long initialBackoffMs = 100;
        private double backoffMultiplier = 2.0;
    }
}

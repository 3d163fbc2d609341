package com.rostrum.debate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Rostrum runtime feature flags and execution defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rostrum")
public class RostrumRuntimeProperties {

    /**
     * Serve all text generation from the deterministic mock backend.
     */
    private boolean mockProvider = true;

    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private String threadNamePrefix = "debate-loop-";
        private int awaitTerminationSeconds = 30;
    }
}

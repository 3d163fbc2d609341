package com.rostrum.debate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Call policy applied to every text-generation request made on behalf of a debater or judge.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rostrum.provider")
public class TextGenerationProperties {

    /**
     * Minimum spacing between two requests of the same participant client.
     */
    private long minRequestIntervalMs = 1_500;

    private int maxAttempts = 5;
    private long initialBackoffMs = 3_000;
    private double backoffMultiplier = 2.0;
    private double randomizationFactor = 0.5;
    private long maxBackoffMs = 30_000;

    /**
     * Wall-clock limit of a single attempt; the in-flight call is cancelled when it expires.
     */
    private long attemptTimeoutMs = 60_000;

    private String mockModel = "rostrum-mock-v1";
    private int mockChunkWords = 8;
}

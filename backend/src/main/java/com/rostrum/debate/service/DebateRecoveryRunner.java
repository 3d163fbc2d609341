package com.rostrum.debate.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Recovers every stored debate once the application is ready.
 */
@Component
@ConditionalOnProperty(
        prefix = "rostrum.store",
        name = "recover-on-startup",
        havingValue = "true",
        matchIfMissing = true
)
public class DebateRecoveryRunner {

    private static final Logger log = LoggerFactory.getLogger(DebateRecoveryRunner.class);

    private final DebateService debateService;

    public DebateRecoveryRunner(DebateService debateService) {
        this.debateService = debateService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverStoredDebates() {
        int recovered = debateService.recoverStoredDebates();
        if (recovered > 0) {
            log.info("Recovered {} stored debates at startup", recovered);
        }
    }
}

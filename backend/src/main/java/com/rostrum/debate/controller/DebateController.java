package com.rostrum.debate.controller;

import com.rostrum.debate.dto.DebateRequests;
import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.service.DebateService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/debates")
public class DebateController {

    private final DebateService debateService;

    public DebateController(DebateService debateService) {
        this.debateService = debateService;
    }

    @PostMapping
    public ResponseEntity<DebateResponses.DebateCreated> createDebate(
            @Valid @RequestBody DebateRequests.CreateDebateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(debateService.createDebate(request));
    }

    @GetMapping("/{debateId}")
    public ResponseEntity<DebateResponses.DebateStatusView> getDebate(@PathVariable String debateId) {
        return ResponseEntity.ok(debateService.getDebateStatus(debateId));
    }

    @PostMapping("/maintenance/cleanup")
    public ResponseEntity<DebateResponses.CleanupResult> cleanupTerminalDebates() {
        return ResponseEntity.ok(debateService.cleanupTerminalDebates());
    }
}

package com.nexusbounty.controller;

import com.nexusbounty.controller.dto.ReputationResponses;
import com.nexusbounty.service.ReputationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/reputation")
public class ReputationController {

    private final ReputationService reputationService;

    public ReputationController(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<ReputationResponses.EngineReputationDetail>> getLeaderboard() {
        return ResponseEntity.ok(reputationService.getLeaderboard().stream()
                .map(ReputationResponses.EngineReputationDetail::from)
                .toList());
    }

    @GetMapping("/{engineId}")
    public ResponseEntity<ReputationResponses.EngineReputationDetail> getReputation(@PathVariable String engineId) {
        return reputationService.getReputation(engineId)
                .map(ReputationResponses.EngineReputationDetail::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No reputation recorded for engine " + engineId));
    }

    @GetMapping("/{engineId}/history")
    public ResponseEntity<List<ReputationResponses.HistoryEntry>> getHistory(@PathVariable String engineId) {
        return ResponseEntity.ok(reputationService.getRecentHistory(engineId).stream()
                .map(ReputationResponses.HistoryEntry::from)
                .toList());
    }
}

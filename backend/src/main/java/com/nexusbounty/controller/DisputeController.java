package com.nexusbounty.controller;

import com.nexusbounty.controller.dto.DisputeRequests;
import com.nexusbounty.controller.dto.DisputeResponses;
import com.nexusbounty.service.DisputeService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/disputes")
public class DisputeController {

    private final DisputeService disputeService;

    public DisputeController(DisputeService disputeService) {
        this.disputeService = disputeService;
    }

    @PostMapping
    public ResponseEntity<DisputeResponses.DisputeDetail> openDispute(
            @Valid @RequestBody DisputeRequests.OpenDisputeRequest request
    ) {
        DisputeResponses.DisputeDetail dispute = disputeService.openDispute(request, OffsetDateTime.now());
        return ResponseEntity.status(HttpStatus.CREATED).body(dispute);
    }

    @GetMapping("/{disputeId}")
    public ResponseEntity<DisputeResponses.DisputeDetail> getDispute(@PathVariable UUID disputeId) {
        return ResponseEntity.ok(disputeService.getDispute(disputeId));
    }

    @PostMapping("/{disputeId}/review")
    public ResponseEntity<DisputeResponses.DisputeDetail> startReview(
            @PathVariable UUID disputeId,
            @Valid @RequestBody DisputeRequests.StartReviewRequest request
    ) {
        return ResponseEntity.ok(disputeService.startReview(disputeId, request.reviewerId(), OffsetDateTime.now()));
    }

    @PostMapping("/{disputeId}/resolve")
    public ResponseEntity<DisputeResponses.DisputeDecision> resolveDispute(
            @PathVariable UUID disputeId,
            @Valid @RequestBody DisputeRequests.ResolveDisputeRequest request
    ) {
        return ResponseEntity.ok(disputeService.resolveDispute(
                disputeId, request.resolution(), request.resolverId(), OffsetDateTime.now()));
    }
}

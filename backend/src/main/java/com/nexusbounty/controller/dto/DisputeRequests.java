package com.nexusbounty.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusbounty.model.DisputeResolution;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

public final class DisputeRequests {

    private DisputeRequests() {
    }

    public record OpenDisputeRequest(
            @NotNull(message = "bountyId is required")
            UUID bountyId,

            @NotNull(message = "submissionId is required")
            UUID submissionId,

            @NotBlank(message = "disputerId is required")
            @Size(max = 128, message = "disputerId must be at most 128 characters")
            String disputerId,

            @NotBlank(message = "disputerWallet is required")
            @Pattern(
                    regexp = "^0x[a-fA-F0-9]{40}$",
                    message = "disputerWallet must be a valid 0x-prefixed EVM address"
            )
            String disputerWallet,

            @NotBlank(message = "reason is required")
            @Size(max = 4000, message = "reason must be at most 4000 characters")
            String reason,

            JsonNode evidence,

            @NotNull(message = "stakeAmount is required")
            @DecimalMin(value = "0", message = "stakeAmount must not be negative")
            BigDecimal stakeAmount,

            boolean adminOverride
    ) {
    }

    public record StartReviewRequest(
            @NotBlank(message = "reviewerId is required")
            String reviewerId
    ) {
    }

    public record ResolveDisputeRequest(
            @NotNull(message = "resolution is required")
            DisputeResolution resolution,

            @NotBlank(message = "resolverId is required")
            String resolverId
    ) {
    }
}

package com.nexusbounty.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.nexusbounty.model.PayoutType;
import com.nexusbounty.model.SettlementKind;
import com.nexusbounty.model.SubmissionStatus;
import org.web3j.crypto.Hash;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deterministic settlement planner.
 * Pure function: the same bounty, version and participants always produce the same plan and hash.
 * <ul>
 *     <li>Correct: full stake back plus a weight-proportional share of the reward pool.</li>
 *     <li>Incorrect or excluded: slash fraction of the stake to the treasury, remainder returned.</li>
 *     <li>Not scored (below minimum stake): full stake back.</li>
 *     <li>No correct submission: reward refunded to the creator.</li>
 * </ul>
 * Amounts carry 8 decimals. Shares round down and the last correct recipient absorbs the dust.
 */
public class SettlementPlanner {

    public static final int AMOUNT_SCALE = 8;

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();
    private static final Comparator<SettlementParticipant> CANONICAL_ORDER = Comparator
            .comparing(SettlementParticipant::submittedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SettlementParticipant::submissionId);

    private final BigDecimal slashFraction;
    private final BigDecimal platformFeeRate;
    private final String treasuryAddress;

    public SettlementPlanner(BigDecimal slashFraction, BigDecimal platformFeeRate, String treasuryAddress) {
        if (slashFraction == null || slashFraction.signum() < 0 || slashFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("slashFraction must be within [0, 1]: " + slashFraction);
        }
        if (platformFeeRate == null || platformFeeRate.signum() < 0 || platformFeeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("platformFeeRate must be within [0, 1): " + platformFeeRate);
        }
        if (treasuryAddress == null || treasuryAddress.isBlank()) {
            throw new IllegalArgumentException("treasuryAddress is required");
        }
        this.slashFraction = slashFraction;
        this.platformFeeRate = platformFeeRate;
        this.treasuryAddress = treasuryAddress.trim();
    }

    public SettlementPlan planResolution(
            UUID bountyId,
            int version,
            SettlementKind kind,
            String creatorAddress,
            BigDecimal rewardAmount,
            List<SettlementParticipant> participants
    ) {
        List<SettlementParticipant> ordered = participants.stream().sorted(CANONICAL_ORDER).toList();
        List<SettlementParticipant> correct = ordered.stream()
                .filter(participant -> participant.status() == SubmissionStatus.CORRECT)
                .toList();

        BigDecimal reward = amount(rewardAmount);
        BigDecimal fee = correct.isEmpty()
                ? BigDecimal.ZERO.setScale(AMOUNT_SCALE)
                : reward.multiply(platformFeeRate).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
        Map<UUID, BigDecimal> rewardShares = splitRewardPool(reward.subtract(fee), correct);

        List<PayoutAction> actions = new ArrayList<>();
        for (SettlementParticipant participant : ordered) {
            BigDecimal stake = amount(participant.stakeAmount());
            switch (participant.status()) {
                case CORRECT -> {
                    addAction(actions, bountyId, version, PayoutType.STAKE_RETURN, participant.recipient(), stake,
                            participant.submissionId());
                    addAction(actions, bountyId, version, PayoutType.BOUNTY_REWARD, participant.recipient(),
                            rewardShares.get(participant.submissionId()), participant.submissionId());
                }
                case INCORRECT, EXCLUDED -> {
                    BigDecimal slashed = stake.multiply(slashFraction).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
                    addAction(actions, bountyId, version, PayoutType.STAKE_SLASH, treasuryAddress, slashed,
                            participant.submissionId());
                    addAction(actions, bountyId, version, PayoutType.STAKE_RETURN, participant.recipient(),
                            stake.subtract(slashed), participant.submissionId());
                }
                case PENDING -> addAction(actions, bountyId, version, PayoutType.STAKE_RETURN,
                        participant.recipient(), stake, participant.submissionId());
            }
        }

        addAction(actions, bountyId, version, PayoutType.FEE, treasuryAddress, fee, null);
        if (correct.isEmpty()) {
            addAction(actions, bountyId, version, PayoutType.REFUND, creatorAddress, reward, null);
        }
        return seal(bountyId, version, kind, actions);
    }

    /**
     * Expired bounties return every stake in full and refund the reward. Nobody is slashed.
     */
    public SettlementPlan planExpiry(
            UUID bountyId,
            int version,
            String creatorAddress,
            BigDecimal rewardAmount,
            List<SettlementParticipant> participants
    ) {
        List<PayoutAction> actions = new ArrayList<>();
        for (SettlementParticipant participant : participants.stream().sorted(CANONICAL_ORDER).toList()) {
            addAction(actions, bountyId, version, PayoutType.STAKE_RETURN, participant.recipient(),
                    amount(participant.stakeAmount()), participant.submissionId());
        }
        addAction(actions, bountyId, version, PayoutType.REFUND, creatorAddress, amount(rewardAmount), null);
        return seal(bountyId, version, SettlementKind.EXPIRY, actions);
    }

    /**
     * Rebases a target plan on what earlier plans already delivered. Value is never clawed back:
     * a shortfall becomes a compensating payout, an excess is reported as unrecoverable.
     * <p>
     * A submission's stake leaves escrow once. A slash shortfall is only paid from stake still in
     * escrow, and a return shortfall may additionally be funded by slashes the treasury already took
     * from that same submission.
     *
     * @param delivered amounts already in flight or paid, keyed by {@link #deliveryKey}
     */
    public CorrectionPlan correct(SettlementPlan target, Map<String, BigDecimal> delivered) {
        if (delivered.isEmpty()) {
            return new CorrectionPlan(target, BigDecimal.ZERO.setScale(AMOUNT_SCALE));
        }

        Map<String, BigDecimal> remaining = new LinkedHashMap<>();
        delivered.forEach((key, value) -> remaining.put(key, amount(value)));

        Map<UUID, BigDecimal> escrowLeft = new LinkedHashMap<>();
        for (PayoutAction action : target.actions()) {
            if (isStakeAction(action)) {
                escrowLeft.merge(action.submissionId(), action.amount(), BigDecimal::add);
            }
        }
        escrowLeft.replaceAll((submissionId, stake) -> stake
                .subtract(remaining.getOrDefault(deliveryKey(submissionId, null, PayoutType.STAKE_RETURN), BigDecimal.ZERO))
                .subtract(remaining.getOrDefault(deliveryKey(submissionId, null, PayoutType.STAKE_SLASH), BigDecimal.ZERO))
                .max(BigDecimal.ZERO));

        Map<PayoutAction, BigDecimal> shortfalls = new LinkedHashMap<>();
        for (PayoutAction action : target.actions()) {
            String key = deliveryKey(action);
            BigDecimal alreadyDelivered = remaining.getOrDefault(key, BigDecimal.ZERO);
            BigDecimal covered = alreadyDelivered.min(action.amount());
            remaining.put(key, alreadyDelivered.subtract(covered));
            shortfalls.put(action, action.amount().subtract(covered));
        }

        List<PayoutAction> actions = new ArrayList<>();
        for (Map.Entry<PayoutAction, BigDecimal> entry : shortfalls.entrySet()) {
            PayoutAction action = entry.getKey();
            BigDecimal payable = entry.getValue();
            if (payable.signum() > 0 && isStakeAction(action)) {
                payable = fundStakeShortfall(action, payable, escrowLeft, remaining);
            }
            if (payable.signum() > 0) {
                actions.add(new PayoutAction(action.type(), action.recipient(), payable, action.submissionId(),
                        action.disputeId(), action.idempotencyKey()));
            }
        }

        BigDecimal unrecoverable = remaining.values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(AMOUNT_SCALE, RoundingMode.DOWN);
        SettlementPlan plan = seal(target.bountyId(), target.settlementVersion(), target.kind(), actions);
        return new CorrectionPlan(plan, unrecoverable);
    }

    private BigDecimal fundStakeShortfall(PayoutAction action, BigDecimal shortfall,
                                          Map<UUID, BigDecimal> escrowLeft, Map<String, BigDecimal> remaining) {
        UUID submissionId = action.submissionId();
        BigDecimal fromEscrow = escrowLeft.getOrDefault(submissionId, BigDecimal.ZERO).min(shortfall);
        escrowLeft.put(submissionId, escrowLeft.getOrDefault(submissionId, BigDecimal.ZERO).subtract(fromEscrow));
        if (action.type() != PayoutType.STAKE_RETURN) {
            return fromEscrow;
        }

        String slashKey = deliveryKey(submissionId, null, PayoutType.STAKE_SLASH);
        BigDecimal slashSurplus = remaining.getOrDefault(slashKey, BigDecimal.ZERO);
        BigDecimal fromTreasury = slashSurplus.min(shortfall.subtract(fromEscrow));
        remaining.put(slashKey, slashSurplus.subtract(fromTreasury));
        return fromEscrow.add(fromTreasury);
    }

    /**
     * Return or slash of a disputer's stake once the dispute is decided.
     */
    public PayoutAction disputeStakeAction(UUID bountyId, UUID disputeId, String disputerWallet,
                                           BigDecimal stakeAmount, boolean accepted) {
        PayoutType type = accepted ? PayoutType.STAKE_RETURN : PayoutType.STAKE_SLASH;
        String recipient = accepted ? disputerWallet : treasuryAddress;
        return new PayoutAction(type, recipient, amount(stakeAmount), null, disputeId,
                bountyId + ":dispute:" + disputeId + ":" + type.name());
    }

    public JsonNode toJson(SettlementPlan plan) {
        return CANONICAL_MAPPER.valueToTree(plan);
    }

    /**
     * Reconciliation key: per submission for stake and reward actions, per recipient for bounty-level ones.
     */
    public static String deliveryKey(UUID submissionId, String recipient, PayoutType type) {
        return (submissionId != null ? "submission:" + submissionId : recipient) + "|" + type.name();
    }

    private static String deliveryKey(PayoutAction action) {
        return deliveryKey(action.submissionId(), action.recipient(), action.type());
    }

    private static boolean isStakeAction(PayoutAction action) {
        return action.submissionId() != null
                && (action.type() == PayoutType.STAKE_RETURN || action.type() == PayoutType.STAKE_SLASH);
    }

    private Map<UUID, BigDecimal> splitRewardPool(BigDecimal pool, List<SettlementParticipant> correct) {
        Map<UUID, BigDecimal> shares = new LinkedHashMap<>();
        if (correct.isEmpty()) {
            return shares;
        }

        BigDecimal totalWeight = correct.stream()
                .map(participant -> participant.weight() == null ? BigDecimal.ZERO : participant.weight())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        boolean equalSplit = totalWeight.signum() <= 0;

        BigDecimal distributed = BigDecimal.ZERO;
        for (int i = 0; i < correct.size(); i++) {
            SettlementParticipant participant = correct.get(i);
            BigDecimal share;
            if (i == correct.size() - 1) {
                share = pool.subtract(distributed);
            } else if (equalSplit) {
                share = pool.divide(BigDecimal.valueOf(correct.size()), AMOUNT_SCALE, RoundingMode.DOWN);
            } else {
                share = pool.multiply(participant.weight() == null ? BigDecimal.ZERO : participant.weight())
                        .divide(totalWeight, AMOUNT_SCALE, RoundingMode.DOWN);
            }
            shares.put(participant.submissionId(), share);
            distributed = distributed.add(share);
        }
        return shares;
    }

    private void addAction(List<PayoutAction> actions, UUID bountyId, int version, PayoutType type,
                           String recipient, BigDecimal amount, UUID submissionId) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        String idempotencyKey = bountyId + ":v" + version + ":" + type.name() + ":"
                + (submissionId == null ? "bounty" : submissionId.toString());
        actions.add(new PayoutAction(type, recipient, amount.setScale(AMOUNT_SCALE, RoundingMode.DOWN),
                submissionId, null, idempotencyKey));
    }

    private SettlementPlan seal(UUID bountyId, int version, SettlementKind kind, List<PayoutAction> actions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bountyId", bountyId);
        body.put("settlementVersion", version);
        body.put("kind", kind);
        body.put("actions", actions);
        return new SettlementPlan(bountyId, version, kind, actions, generateHash(body));
    }

    private String generateHash(Object body) {
        try {
            return Hash.sha3String(CANONICAL_MAPPER.writeValueAsString(body));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize settlement plan", ex);
        }
    }

    private static BigDecimal amount(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
    }
}

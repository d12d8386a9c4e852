package com.nexusbounty.consensus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public final class ConsensusResultJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .build();

    private ConsensusResultJsonCodec() {
    }

    public static JsonNode toJson(ConsensusResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        return OBJECT_MAPPER.valueToTree(result);
    }

    public static ConsensusResult fromJson(JsonNode json) {
        if (json == null || json.isNull() || !json.isObject()) {
            throw new IllegalArgumentException("Consensus result JSON must be an object");
        }
        try {
            return OBJECT_MAPPER.treeToValue(json, ConsensusResult.class);
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new IllegalArgumentException("Consensus result JSON is malformed", ex);
        }
    }
}

package com.interaction.clustering.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.core.exception.MalformedRecordException;
import com.interaction.clustering.core.model.InteractionRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON Lines (JSONL) interaction source: one JSON object per line.
 *
 * <pre>
 * {"cardholder_id": "C1", "merchant_id": "M1", "weight": 2, "timestamp": "2024-01-01T00:00:00Z"}
 * {"cardholder_id": "C1", "merchant_id": "M2"}
 * </pre>
 */
public class JsonLinesInteractionSource extends LineInteractionSource {

    private final ObjectMapper objectMapper;

    public JsonLinesInteractionSource(Reader reader) {
        this(reader, new ObjectMapper());
    }

    public JsonLinesInteractionSource(Reader reader, ObjectMapper objectMapper) {
        super(reader);
        this.objectMapper = objectMapper;
    }

    public static JsonLinesInteractionSource open(Path path) {
        try {
            return new JsonLinesInteractionSource(Files.newBufferedReader(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ClusteringException("Cannot open input " + path, e);
        }
    }

    @Override
    protected InteractionRecord parseLine(String line, long lineNumber) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(lineNumber, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedRecordException(lineNumber, "expected a JSON object");
        }
        String cardholderId = requiredText(node, "cardholder_id", lineNumber);
        String merchantId = requiredText(node, "merchant_id", lineNumber);

        long weight = InteractionRecord.DEFAULT_WEIGHT;
        JsonNode weightNode = node.get("weight");
        if (weightNode != null && !weightNode.isNull()) {
            if (weightNode.canConvertToExactIntegral() && weightNode.canConvertToLong()) {
                weight = weightNode.longValue();
            } else if (weightNode.isTextual()) {
                try {
                    weight = Long.parseLong(weightNode.textValue().trim());
                } catch (NumberFormatException e) {
                    throw new MalformedRecordException(lineNumber, "weight is not an integer: " + weightNode, e);
                }
            } else {
                throw new MalformedRecordException(lineNumber, "weight is not an integer: " + weightNode);
            }
        }

        Instant timestamp = null;
        JsonNode timestampNode = node.get("timestamp");
        if (timestampNode != null && !timestampNode.isNull()) {
            try {
                timestamp = Instant.parse(timestampNode.asText());
            } catch (DateTimeParseException e) {
                throw new MalformedRecordException(lineNumber, "invalid timestamp: " + timestampNode, e);
            }
        }
        return new InteractionRecord(cardholderId, merchantId, weight, timestamp);
    }

    private static String requiredText(JsonNode node, String field, long lineNumber) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new MalformedRecordException(lineNumber, "missing field '" + field + "'");
        }
        return value.asText();
    }
}

package com.interaction.clustering.bulk;

import com.interaction.clustering.core.exception.MalformedRecordException;
import com.interaction.clustering.core.model.InteractionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesInteractionSourceTest {

    @Test
    @DisplayName("Should read JSON Lines records")
    void testReadRecords() {
        String jsonl = """
                {"cardholder_id": "C1", "merchant_id": "M1", "weight": 2, "timestamp": "2024-03-01T10:15:30Z"}

                {"cardholder_id": 42, "merchant_id": "M2"}
                {"cardholder_id": "C3", "merchant_id": "M3", "weight": "7"}
                """;

        List<InteractionRecord> records =
                CsvInteractionSourceTest.readAll(new JsonLinesInteractionSource(new StringReader(jsonl)));

        assertEquals(List.of(
                new InteractionRecord("C1", "M1", 2, Instant.parse("2024-03-01T10:15:30Z")),
                InteractionRecord.of("42", "M2"),
                InteractionRecord.of("C3", "M3", 7)), records);
    }

    @Test
    @DisplayName("Should reject invalid JSON, missing fields and non-integer weights")
    void testMalformed() {
        String jsonl = """
                {"cardholder_id": "C1", "merchant_id":
                {"merchant_id": "M1"}
                {"cardholder_id": "C1", "merchant_id": "M1", "weight": 1.5}
                [1, 2]
                {"cardholder_id": "C2", "merchant_id": "M2"}
                """;
        JsonLinesInteractionSource source = new JsonLinesInteractionSource(new StringReader(jsonl));

        assertEquals(1, assertThrows(MalformedRecordException.class, source::next).getLineNumber());
        assertEquals(2, assertThrows(MalformedRecordException.class, source::next).getLineNumber());
        assertEquals(3, assertThrows(MalformedRecordException.class, source::next).getLineNumber());
        assertEquals(4, assertThrows(MalformedRecordException.class, source::next).getLineNumber());
        assertEquals("C2", source.next().orElseThrow().cardholderId());
        assertTrue(source.next().isEmpty());
    }
}

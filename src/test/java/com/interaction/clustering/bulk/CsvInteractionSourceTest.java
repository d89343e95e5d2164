package com.interaction.clustering.bulk;

import com.interaction.clustering.core.exception.MalformedRecordException;
import com.interaction.clustering.core.model.InteractionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CsvInteractionSourceTest {

    @Test
    @DisplayName("Should read CSV with header, optional weight and timestamp")
    void testReadWithHeader() {
        String csv = """
                cardholder_id,merchant_id,weight,timestamp
                C1,M1,3,2024-01-01T00:00:00Z
                C1,M2
                "C2",M1,,
                """;

        List<InteractionRecord> records = readAll(new CsvInteractionSource(new StringReader(csv)));

        assertEquals(3, records.size());
        assertEquals(new InteractionRecord("C1", "M1", 3, Instant.parse("2024-01-01T00:00:00Z")), records.get(0));
        assertEquals(InteractionRecord.of("C1", "M2"), records.get(1));
        assertEquals(InteractionRecord.of("C2", "M1"), records.get(2));
    }

    @Test
    @DisplayName("Should keep a first record whose id merely starts like the header")
    void testFirstRecordResemblingHeader() {
        String csv = """
                cardholder7,M1
                C2,M1
                """;

        List<InteractionRecord> records = readAll(new CsvInteractionSource(new StringReader(csv)));

        assertEquals(List.of(InteractionRecord.of("cardholder7", "M1"), InteractionRecord.of("C2", "M1")), records);
    }

    @Test
    @DisplayName("Should recognise a quoted upper-case header")
    void testQuotedHeader() {
        String csv = """
                "CARDHOLDER_ID","Merchant_Id"
                C1,M1
                """;

        assertEquals(List.of(InteractionRecord.of("C1", "M1")),
                readAll(new CsvInteractionSource(new StringReader(csv))));
    }

    @Test
    @DisplayName("Should read whitespace-separated lines without header")
    void testWhitespaceSeparated() {
        String input = """
                C1 M6
                C2\tM7   4

                # a comment
                C3 M6
                """;

        List<InteractionRecord> records = readAll(new CsvInteractionSource(new StringReader(input)));

        assertEquals(List.of(
                InteractionRecord.of("C1", "M6"),
                InteractionRecord.of("C2", "M7", 4),
                InteractionRecord.of("C3", "M6")), records);
    }

    @Test
    @DisplayName("Should report malformed lines with their line number and keep reading")
    void testMalformedLines() {
        String csv = """
                cardholder_id,merchant_id
                C1,M1
                only-one-field
                C2,M2,heavy
                C3,M3,1,yesterday
                C4,M4
                """;
        CsvInteractionSource source = new CsvInteractionSource(new StringReader(csv));

        assertEquals("C1", source.next().orElseThrow().cardholderId());
        MalformedRecordException fields = assertThrows(MalformedRecordException.class, source::next);
        assertEquals(3, fields.getLineNumber());
        MalformedRecordException weight = assertThrows(MalformedRecordException.class, source::next);
        assertEquals(4, weight.getLineNumber());
        MalformedRecordException timestamp = assertThrows(MalformedRecordException.class, source::next);
        assertEquals(5, timestamp.getLineNumber());
        assertEquals("C4", source.next().orElseThrow().cardholderId());
        assertEquals(6, source.position());
        assertTrue(source.next().isEmpty());
    }

    @Test
    @DisplayName("Should return nothing for empty input")
    void testEmptyInput() {
        CsvInteractionSource source = new CsvInteractionSource(new StringReader(""));

        assertEquals(Optional.empty(), source.next());
        assertEquals(0, source.position());
    }

    static List<InteractionRecord> readAll(InteractionSource source) {
        List<InteractionRecord> records = new ArrayList<>();
        try (source) {
            Optional<InteractionRecord> next;
            while ((next = source.next()).isPresent()) {
                records.add(next.get());
            }
        }
        return records;
    }
}

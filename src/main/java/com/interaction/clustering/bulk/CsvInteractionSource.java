package com.interaction.clustering.bulk;

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
import java.util.Locale;

/**
 * CSV interaction source.
 *
 * <p>Expected format:</p>
 * <pre>
 * cardholder_id,merchant_id,weight,timestamp
 * C1,M1,1,2024-01-01T00:00:00Z
 * C1,M2
 * </pre>
 *
 * <p>The header row is optional and recognised by its first column name. Weight and
 * timestamp are optional. Lines without a comma are split on whitespace, which accepts
 * the {@code C1 M6} transaction dumps. Lines starting with {@code #} are comments.</p>
 */
public class CsvInteractionSource extends LineInteractionSource {

    private boolean firstLine = true;

    public CsvInteractionSource(Reader reader) {
        super(reader);
    }

    public static CsvInteractionSource open(Path path) {
        try {
            return new CsvInteractionSource(Files.newBufferedReader(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ClusteringException("Cannot open input " + path, e);
        }
    }

    @Override
    protected InteractionRecord parseLine(String line, long lineNumber) {
        String[] fields = line.indexOf(',') >= 0 ? line.split(",", -1) : line.split("\\s+");
        boolean header = firstLine && isHeader(fields);
        firstLine = false;
        if (header || line.startsWith("#")) {
            return null;
        }
        if (fields.length < 2 || fields.length > 4) {
            throw new MalformedRecordException(lineNumber,
                    "expected 2 to 4 fields but found " + fields.length);
        }
        String cardholderId = parseCsvField(fields[0]);
        String merchantId = parseCsvField(fields[1]);
        long weight = InteractionRecord.DEFAULT_WEIGHT;
        if (fields.length > 2 && !fields[2].isBlank()) {
            try {
                weight = Long.parseLong(parseCsvField(fields[2]));
            } catch (NumberFormatException e) {
                throw new MalformedRecordException(lineNumber, "weight is not an integer: '" + fields[2].trim() + "'", e);
            }
        }
        Instant timestamp = null;
        if (fields.length > 3 && !fields[3].isBlank()) {
            try {
                timestamp = Instant.parse(parseCsvField(fields[3]));
            } catch (DateTimeParseException e) {
                throw new MalformedRecordException(lineNumber, "invalid timestamp: '" + fields[3].trim() + "'", e);
            }
        }
        return new InteractionRecord(cardholderId, merchantId, weight, timestamp);
    }

    private static boolean isHeader(String[] fields) {
        return fields.length >= 2
                && parseCsvField(fields[0]).toLowerCase(Locale.ROOT).equals("cardholder_id")
                && parseCsvField(fields[1]).toLowerCase(Locale.ROOT).equals("merchant_id");
    }

    /**
     * Parses a CSV field, handling quoted values.
     */
    private static String parseCsvField(String field) {
        String value = field.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"");
        }
        return value;
    }
}

package com.interaction.clustering.bulk;

import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.core.model.InteractionRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Optional;

/**
 * Base class of line-oriented sources: one record per line, blank lines ignored.
 */
public abstract class LineInteractionSource implements InteractionSource {

    private final BufferedReader reader;
    private long lineNumber;

    protected LineInteractionSource(Reader reader) {
        this.reader = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    }

    /**
     * Parses one non-blank line.
     *
     * @return the record, or null if the line carries no record (a header or comment)
     * @throws com.interaction.clustering.core.exception.MalformedRecordException if the line is malformed
     */
    protected abstract InteractionRecord parseLine(String line, long lineNumber);

    @Override
    public Optional<InteractionRecord> next() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                InteractionRecord record = parseLine(trimmed, lineNumber);
                if (record != null) {
                    return Optional.of(record);
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new ClusteringException("Failed to read input at line " + (lineNumber + 1), e);
        }
    }

    @Override
    public long position() {
        return lineNumber;
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            throw new ClusteringException("Failed to close input", e);
        }
    }
}

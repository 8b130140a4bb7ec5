package com.di.flightwarehouse.storage;

import com.di.flightwarehouse.exception.StructuralPipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Streams a fact CSV (header row, one flight per line) from the raw bucket.
 * <p>
 * Only one chunk of records is held at a time. The header is checked for the caller's required
 * columns before the first record is handed out; a missing column or an unparseable line is a
 * {@link StructuralPipelineException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FactFileReader {

    /** BTS exports end every line with a comma, which yields an unnamed trailing column. */
    static final CSVFormat FACT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final RawFileCatalog catalog;

    @FunctionalInterface
    public interface ChunkConsumer {
        /**
         * @param chunkIndex    0-based chunk number within the file
         * @param firstRowIndex 0-based data-row index of {@code rows.get(0)}
         * @param rows          at most chunkSize records
         */
        void accept(int chunkIndex, long firstRowIndex, List<CSVRecord> rows);
    }

    /** Streams every record of the file to {@code consumer}. */
    public void scan(RawFile file, Collection<String> requiredColumns, Consumer<CSVRecord> consumer) {
        readChunks(file, requiredColumns, 1, (chunk, first, rows) -> rows.forEach(consumer));
    }

    /**
     * Streams the file in chunks of at most {@code chunkSize} records.
     * Exceptions thrown by the consumer propagate unchanged.
     */
    public void readChunks(RawFile file, Collection<String> requiredColumns, int chunkSize, ChunkConsumer consumer) {
        try (Reader reader = catalog.open(file);
             CSVParser parser = FACT_FORMAT.parse(reader)) {
            Map<String, Integer> headerMap = parser.getHeaderMap();
            requireColumns(file, headerMap == null ? Set.of() : headerMap.keySet(), requiredColumns);

            List<CSVRecord> chunk = new ArrayList<>(Math.min(chunkSize, 10_000));
            int chunkIndex = 0;
            long rowIndex = 0;
            long chunkStart = 0;
            for (CSVRecord record : iterate(file, parser)) {
                chunk.add(record);
                rowIndex++;
                if (chunk.size() == chunkSize) {
                    consumer.accept(chunkIndex++, chunkStart, chunk);
                    chunk = new ArrayList<>(Math.min(chunkSize, 10_000));
                    chunkStart = rowIndex;
                }
            }
            if (!chunk.isEmpty()) {
                consumer.accept(chunkIndex, chunkStart, chunk);
            }
        } catch (IOException e) {
            throw StructuralPipelineException.inFile(file.fileName(), "Cannot read fact file", e);
        }
    }

    /** Column value, or null when the line is shorter than the header or the column is absent. */
    public static String field(CSVRecord record, String column) {
        return record.isMapped(column) && record.isSet(column) ? record.get(column) : null;
    }

    private static Iterable<CSVRecord> iterate(RawFile file, CSVParser parser) {
        return () -> new Iterator<>() {
            private final Iterator<CSVRecord> delegate = parser.iterator();

            @Override
            public boolean hasNext() {
                try {
                    return delegate.hasNext();
                } catch (UncheckedIOException | IllegalStateException e) {
                    throw StructuralPipelineException.inFile(file.fileName(), "Malformed CSV after line " + parser.getCurrentLineNumber(), e);
                }
            }

            @Override
            public CSVRecord next() {
                return delegate.next();
            }
        };
    }

    private static void requireColumns(RawFile file, Set<String> header, Collection<String> required) {
        for (String column : required) {
            if (!header.contains(column)) {
                throw StructuralPipelineException.inFile(file.fileName(), "Missing required column '" + column + "'", null);
            }
        }
    }
}

package com.example.interval_optimizer.service;

import com.example.interval_optimizer.selector.Interval;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads intervals from a CSV file with the header {@code Interval_start,Interval_end,Cost}.
 */
@Component
public class CsvIntervalSource implements IntervalSource {
    private static final Logger log = LoggerFactory.getLogger(CsvIntervalSource.class);

    public static final String START_COLUMN = "Interval_start";
    public static final String END_COLUMN = "Interval_end";
    public static final String COST_COLUMN = "Cost";

    private final CsvMapper mapper;
    private final CsvSchema schema;

    public CsvIntervalSource() {
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                .build();
        this.schema = CsvSchema.emptySchema().withHeader();
    }

    @Override
    public List<Interval> read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read intervals from " + path, e);
        }
    }

    @Override
    public List<Interval> read(InputStream in, String sourceName) {
        List<Interval> intervals = new ArrayList<>();
        int row = 0;
        try {
            MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                    .with(schema)
                    .readValues(in); // byte input: the parser skips a UTF-8 BOM
            while (rows.hasNextValue()) {
                Map<String, String> record = rows.nextValue();
                row++;
                intervals.add(new Interval(
                        intColumn(record, START_COLUMN, sourceName, row),
                        intColumn(record, END_COLUMN, sourceName, row),
                        intColumn(record, COST_COLUMN, sourceName, row)));
            }
        } catch (JsonProcessingException e) {
            throw new IntervalDataException("Malformed CSV in " + sourceName + " after row " + row + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read intervals from " + sourceName, e);
        }
        log.info("Loaded {} intervals from {}", intervals.size(), sourceName);
        return intervals;
    }

    private static int intColumn(Map<String, String> record, String column, String sourceName, int row) {
        String raw = record.get(column);
        if (raw == null || raw.isBlank()) {
            throw new IntervalDataException(String.format("%s row %d: missing value for column %s",
                    sourceName, row, column));
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IntervalDataException(String.format("%s row %d: column %s is not an integer: '%s'",
                    sourceName, row, column, raw), e);
        }
    }
}

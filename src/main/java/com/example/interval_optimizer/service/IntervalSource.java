package com.example.interval_optimizer.service;

import com.example.interval_optimizer.selector.Interval;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Supplies interval records, one per row.
 */
public interface IntervalSource {

    /**
     * Reads all intervals from a file.
     *
     * @param path file to read.
     * @return intervals in file order.
     * @throws IntervalDataException when a row is missing a column or holds a non-integer value.
     */
    List<Interval> read(Path path);

    /**
     * Reads all intervals from a stream; the stream is not closed.
     *
     * @param in         stream to read.
     * @param sourceName name used in error messages.
     * @return intervals in stream order.
     * @throws IntervalDataException when a row is missing a column or holds a non-integer value.
     */
    List<Interval> read(InputStream in, String sourceName);
}

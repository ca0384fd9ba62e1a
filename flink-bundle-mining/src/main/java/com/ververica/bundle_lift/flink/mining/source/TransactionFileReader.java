package com.ververica.bundle_lift.flink.mining.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ververica.bundle_lift.flink.mining.shared.model.TransactionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads item-level transaction rows exported by the ingestion service.
 *
 * Handles, line by line:
 * - JSON arrays: [{"transaction_id":"T1",...}, {"transaction_id":"T1",...}]
 * - Single objects: {"transaction_id":"T1",...}
 *
 * ERROR HANDLING:
 * - Blank lines are ignored
 * - Lines that fail to parse are logged and skipped, the read continues
 * - I/O failures propagate as IOException
 */
public class TransactionFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionFileReader.class);

    private final ObjectMapper mapper;

    public TransactionFileReader() {
        this(new ObjectMapper());
    }

    public TransactionFileReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<TransactionRow> readRows(Path path) throws IOException {
        LOG.info("Reading transaction rows from {}", path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readRows(reader);
        }
    }

    public List<TransactionRow> readRows(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        List<TransactionRow> rows = new ArrayList<>();
        int lineNumber = 0;
        int failed = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                if (trimmed.startsWith("[")) {
                    rows.addAll(Arrays.asList(mapper.readValue(trimmed, TransactionRow[].class)));
                } else if (trimmed.startsWith("{")) {
                    rows.add(mapper.readValue(trimmed, TransactionRow.class));
                } else {
                    LOG.warn("Line {} is not JSON (doesn't start with [ or {{): {}",
                        lineNumber, trimmed.substring(0, Math.min(100, trimmed.length())));
                    failed++;
                }
            } catch (IOException e) {
                // Log but don't fail - continue with the remaining lines
                LOG.error("Failed to parse line {}: {}. Error: {}",
                    lineNumber, trimmed.substring(0, Math.min(200, trimmed.length())), e.getMessage());
                failed++;
            }
        }

        if (failed > 0) {
            LOG.warn("{} of {} lines could not be parsed", failed, lineNumber);
        }
        LOG.info("Read {} transaction rows", rows.size());
        return rows;
    }
}

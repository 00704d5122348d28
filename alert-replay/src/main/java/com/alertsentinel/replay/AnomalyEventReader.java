package com.alertsentinel.replay;

import com.alertsentinel.core.model.AnomalyEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads newline-delimited JSON into {@link AnomalyEvent}s.
 * <p>
 * Blank lines are ignored. Malformed lines are logged and dropped, so a
 * single bad record does not abort the replay.
 * </p>
 */
public class AnomalyEventReader {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEventReader.class);

    private final ObjectMapper mapper;

    public AnomalyEventReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param file NDJSON file
     * @return every well-formed event, in file order
     * @throws IOException if the file cannot be read
     */
    public List<AnomalyEvent> readAll(Path file) throws IOException {
        List<AnomalyEvent> events = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Optional<AnomalyEvent> event = parse(line, lineNumber);
                if (event.isPresent()) {
                    events.add(event.get());
                } else {
                    skipped++;
                }
            }
        }
        LOG.info("Read {} event(s) from {} ({} malformed line(s) skipped)", events.size(), file, skipped);
        return events;
    }

    /**
     * @param line one JSON object
     * @return the event, or empty if the line is not a valid event
     */
    public Optional<AnomalyEvent> parse(String line) {
        return parse(line, 0);
    }

    private Optional<AnomalyEvent> parse(String line, int lineNumber) {
        try {
            return Optional.ofNullable(mapper.readValue(line, AnomalyEvent.class));
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to parse event at line {} – skipping: {}", lineNumber, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}

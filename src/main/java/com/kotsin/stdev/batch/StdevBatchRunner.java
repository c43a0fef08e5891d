package com.kotsin.stdev.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Runs a single batch at startup from {@code --start=...} and {@code --end=...}.
 *
 * Times are ISO-8601 instants; a local date-time without offset is read as UTC.
 */
@Component
@ConditionalOnProperty(name = "stdev.runner.enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class StdevBatchRunner implements ApplicationRunner {

    private final StdevBatchService batchService;
    private final ObjectProvider<SnapshotSource> sources;

    @Override
    public void run(ApplicationArguments args) {
        Instant start = requiredInstant(args, "start");
        Instant end = requiredInstant(args, "end");

        SnapshotSource source = sources.getIfAvailable();
        if (source == null) {
            throw new IllegalStateException(
                "No SnapshotSource configured; set stdev.input.kafka.enabled=true or provide a SnapshotSource bean");
        }
        batchService.run(source, start, end);
    }

    static Instant requiredInstant(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Missing required option --" + option);
        }
        return parseInstant(option, values.get(values.size() - 1));
    }

    static Instant parseInstant(String option, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("Option --" + option + " is not an ISO-8601 time: " + value, inner);
            }
        }
    }
}

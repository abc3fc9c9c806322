/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.combat.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Appends audit entries to daily JSONL files.
 * <p>
 * Files are named {@code combat-audit-yyyy-MM-dd.jsonl} (UTC). When a file
 * reaches the size limit the next write goes to {@code .1}, {@code .2} and so
 * on. Writes go through a circuit breaker so a failing disk is not retried on
 * every flush.
 */
@Slf4j
public class AuditLogWriter {

    static final String FILE_PREFIX = "combat-audit-";
    static final String FILE_SUFFIX = ".jsonl";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final Pattern FILE_PATTERN =
            Pattern.compile("combat-audit-(\\d{4}-\\d{2}-\\d{2})(?:\\.\\d+)?\\.jsonl");

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long maxFileSizeBytes;
    private final int retentionDays;
    private final CircuitBreaker circuitBreaker;

    public AuditLogWriter(Path outputDirectory, ObjectMapper objectMapper, Clock clock,
                          int maxFileSizeMb, int retentionDays, CircuitBreaker circuitBreaker) {
        if (outputDirectory == null || objectMapper == null || clock == null) {
            throw new IllegalArgumentException("Output directory, object mapper and clock are required");
        }
        this.outputDirectory = outputDirectory;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
        this.maxFileSizeBytes = maxFileSizeMb * 1024L * 1024L;
        this.retentionDays = retentionDays;
        this.circuitBreaker = circuitBreaker != null ? circuitBreaker : CircuitBreaker.ofDefaults("combat-audit-writer");
        this.circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                        log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()));
    }

    /**
     * Writes all entries to the current daily file.
     *
     * @return the file written to
     */
    public Mono<Path> write(List<AuditLogEntry> entries) {
        return Mono.fromCallable(() -> append(entries))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    private Path append(List<AuditLogEntry> entries) throws IOException {
        // serialize first so a bad entry leaves the file untouched
        StringBuilder lines = new StringBuilder(entries.size() * 256);
        for (AuditLogEntry entry : entries) {
            lines.append(toJson(entry)).append('\n');
        }
        Files.createDirectories(outputDirectory);
        Path target = resolveTarget(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
        Files.writeString(target, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        log.debug("Wrote {} audit entries to {}", entries.size(), target);
        return target;
    }

    private String toJson(AuditLogEntry entry) throws JsonProcessingException {
        return objectMapper.writeValueAsString(entry);
    }

    Path resolveTarget(LocalDate date) throws IOException {
        String base = FILE_PREFIX + DATE_FORMAT.format(date);
        Path candidate = outputDirectory.resolve(base + FILE_SUFFIX);
        if (maxFileSizeBytes <= 0) {
            return candidate;
        }
        int index = 1;
        while (Files.exists(candidate) && Files.size(candidate) >= maxFileSizeBytes) {
            candidate = outputDirectory.resolve(base + "." + index + FILE_SUFFIX);
            index++;
        }
        return candidate;
    }

    /**
     * Deletes audit files older than the retention period.
     *
     * @return number of files deleted
     */
    public int cleanupExpired() {
        if (retentionDays <= 0 || !Files.isDirectory(outputDirectory)) {
            return 0;
        }
        LocalDate cutoff = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(retentionDays);
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(outputDirectory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                Matcher matcher = FILE_PATTERN.matcher(file.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                try {
                    LocalDate fileDate = LocalDate.parse(matcher.group(1), DATE_FORMAT);
                    if (fileDate.isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        deleted++;
                    }
                } catch (DateTimeParseException | IOException e) {
                    log.warn("AUDIT_RETENTION_SKIP: file={}, error={}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("AUDIT_RETENTION_FAILED: directory={}", outputDirectory, e);
        }
        if (deleted > 0) {
            log.info("Deleted {} audit files older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker.getState();
    }
}

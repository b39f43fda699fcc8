package com.dcv.validation;

import com.dcv.domain.ValidationResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scheduler run.
 *
 * <p>Holds every per-domain result, the names skipped before dispatch and whether the operator aborted.
 */
public class ValidationReport {
    private final String runId;
    private final Instant started;
    private final Instant finished;
    private final List<ValidationResult> results;
    private final Map<String, String> skipped;
    private final boolean aborted;

    /**
     * Constructs a new ValidationReport instance.
     *
     * @param runId    Run identifier.
     * @param started  Start instant.
     * @param finished End instant.
     * @param results  Results in completion order.
     * @param skipped  Skipped names and reasons.
     * @param aborted  True if the operator declined.
     */
    public ValidationReport(String runId, Instant started, Instant finished, List<ValidationResult> results,
                            Map<String, String> skipped, boolean aborted) {
        this.runId = runId;
        this.started = started;
        this.finished = finished;
        this.results = List.copyOf(results);
        this.skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
        this.aborted = aborted;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStarted() {
        return started;
    }

    public Instant getFinished() {
        return finished;
    }

    public List<ValidationResult> getResults() {
        return results;
    }

    public Map<String, String> getSkipped() {
        return skipped;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * Gets number of validated domains.
     *
     * @return Count.
     */
    public long getValidatedCount() {
        return results.stream().filter(ValidationResult::isValid).count();
    }

    /**
     * Gets number of domains whose DNS record was removed.
     *
     * @return Count.
     */
    public long getCleanedUpCount() {
        return results.stream().filter(ValidationResult::isCleanedUp).count();
    }

    /**
     * Logs one line per domain.
     *
     * @param log Logger instance.
     */
    public void log(Logger log) {
        log.info("Domain Validation complete: {} validated, {} cleaned up, {} total, {} skipped",
                getValidatedCount(), getCleanedUpCount(), results.size(), skipped.size());

        for (ValidationResult result : results) {
            log.info("Domain {} is {} and the cname has {}, with message: {}",
                    result.getDomainName(),
                    result.isValid() ? "validated" : "NOT VALIDATED",
                    result.isCleanedUp() ? "been cleaned up" : "NOT BEEN CLEANED UP",
                    result.getMessage());
        }
        for (Map.Entry<String, String> entry : skipped.entrySet()) {
            log.info("Domain {} skipped: {}", entry.getKey(), entry.getValue());
        }
    }

    /**
     * Gets report as a JSON friendly map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("started", started.toString());
        map.put("finished", finished.toString());
        map.put("aborted", aborted);
        map.put("validated", getValidatedCount());
        map.put("cleanedUp", getCleanedUpCount());

        List<Map<String, Object>> list = new ArrayList<>();
        for (ValidationResult result : results) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("domain", result.getDomainName());
            entry.put("valid", result.isValid());
            entry.put("cleanedUp", result.isCleanedUp());
            entry.put("message", result.getMessage());
            list.add(entry);
        }
        map.put("results", list);
        map.put("skipped", new LinkedHashMap<>(skipped));

        return map;
    }

    /**
     * Gets report as pretty printed JSON.
     *
     * @return JSON string.
     */
    public String toJson() {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(toMap());
    }

    /**
     * Writes report as JSON.
     *
     * @param path File path.
     * @throws IOException Unable to write file.
     */
    public void writeJson(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toJson());
        }
    }
}

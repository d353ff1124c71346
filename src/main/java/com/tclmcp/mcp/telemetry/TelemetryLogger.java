package com.tclmcp.mcp.telemetry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Records tool usage as JSON lines, one file per UTC day, plus a per-session
 * summary written on shutdown. Write failures are logged and never reach callers.
 */
public class TelemetryLogger {
    private static final Logger log = LoggerFactory.getLogger(TelemetryLogger.class);

    private static final String LOG_FILE_PREFIX = "tcl_mcp_telemetry_";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Gson gson = new GsonBuilder().create();
    private final Path telemetryDir;
    private final boolean enabled;
    private final Map<String, ToolMetrics> toolMetrics = new ConcurrentHashMap<>();
    private final AtomicLong sessionRequestCount = new AtomicLong(0);
    private final String sessionId;
    private final long sessionStartTime;

    private static class ToolMetrics {
        final AtomicLong invocationCount = new AtomicLong(0);
        final AtomicLong successCount = new AtomicLong(0);
        final AtomicLong failureCount = new AtomicLong(0);
        final AtomicLong totalDurationMs = new AtomicLong(0);
        final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
        final AtomicLong maxDurationMs = new AtomicLong(0);
        final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    }

    /**
     * One line of the event log. Field names are the JSON keys.
     */
    static final class TelemetryEvent {
        final String timestamp;
        final String sessionId;
        final String eventType;
        final String toolName;
        final Map<String, Object> parameters;
        final boolean success;
        final String errorType;
        final String errorMessage;
        final long durationMs;
        final long responseSize;
        final Map<String, Object> metadata;

        TelemetryEvent(String sessionId, String eventType, String toolName, Map<String, Object> parameters,
                       boolean success, String errorType, String errorMessage, long durationMs,
                       long responseSize, Map<String, Object> metadata) {
            this.timestamp = Instant.now().toString();
            this.sessionId = sessionId;
            this.eventType = eventType;
            this.toolName = toolName;
            this.parameters = parameters;
            this.success = success;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
            this.durationMs = durationMs;
            this.responseSize = responseSize;
            this.metadata = metadata;
        }
    }

    /**
     * @param telemetryDir directory for event and summary files, created if missing
     * @param enabled when false nothing is written, though metrics are still kept
     */
    public TelemetryLogger(Path telemetryDir, boolean enabled) {
        this.telemetryDir = telemetryDir;
        this.enabled = enabled;
        this.sessionStartTime = System.currentTimeMillis();
        this.sessionId = "session_" + UUID.randomUUID();

        if (enabled) {
            try {
                Files.createDirectories(telemetryDir);
                log.debug("Telemetry directory at {}", telemetryDir);
            } catch (IOException e) {
                log.error("Failed to create telemetry directory {}: {}", telemetryDir, e.getMessage());
            }
        }
    }

    /**
     * Log the session start. Call once, right after construction.
     */
    public void init() {
        logSessionEvent("SESSION_START", null);
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Log the start of a tool invocation.
     *
     * @return start time to pass to {@link #logToolSuccess} or {@link #logToolFailure}
     */
    public long logToolStart(String toolName, Map<String, Object> parameters) {
        final long startTime = System.currentTimeMillis();
        final long requestNumber = sessionRequestCount.incrementAndGet();

        final ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        metrics.invocationCount.incrementAndGet();

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionRequestNumber", requestNumber);
        metadata.put("totalInvocations", metrics.invocationCount.get());

        writeEvent(new TelemetryEvent(sessionId, "TOOL_START", toolName, parameters, true,
            null, null, 0, 0, metadata));
        return startTime;
    }

    public void logToolSuccess(String toolName, long startTime, String response) {
        final long duration = System.currentTimeMillis() - startTime;

        final ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics != null) {
            metrics.successCount.incrementAndGet();
            recordDuration(metrics, duration);
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", successRate(toolName));
        metadata.put("avgDuration", avgDuration(toolName));

        writeEvent(new TelemetryEvent(sessionId, "TOOL_SUCCESS", toolName, null, true,
            null, null, duration, response == null ? 0 : response.length(), metadata));
    }

    public void logToolFailure(String toolName, long startTime, String errorType, String errorMessage) {
        final long duration = System.currentTimeMillis() - startTime;
        final String errorKey = errorType != null ? errorType : "UNKNOWN_ERROR";

        final ToolMetrics metrics = toolMetrics.get(toolName);
        long errorTypeCount = 0;
        if (metrics != null) {
            metrics.failureCount.incrementAndGet();
            recordDuration(metrics, duration);
            errorTypeCount = metrics.errorCounts.computeIfAbsent(errorKey, k -> new AtomicLong(0)).incrementAndGet();
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", successRate(toolName));
        metadata.put("failureRate", failureRate(toolName));
        metadata.put("errorTypeCount", errorTypeCount);

        writeEvent(new TelemetryEvent(sessionId, "TOOL_FAILURE", toolName, null, false,
            errorKey, errorMessage, duration, 0, metadata));
    }

    public void logSessionEvent(String eventType, Map<String, Object> metadata) {
        final Map<String, Object> sessionMetadata = new LinkedHashMap<>();
        sessionMetadata.put("sessionDuration", System.currentTimeMillis() - sessionStartTime);
        sessionMetadata.put("totalRequests", sessionRequestCount.get());
        sessionMetadata.put("uniqueToolsUsed", toolMetrics.size());
        if (metadata != null) {
            sessionMetadata.putAll(metadata);
        }
        writeEvent(new TelemetryEvent(sessionId, eventType, null, null, true, null, null, 0, 0, sessionMetadata));
    }

    /**
     * Append this session's per-tool totals to the day's summary file.
     */
    public void generateDailySummary() {
        if (!enabled) {
            return;
        }
        final Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", today());
        summary.put("sessionId", sessionId);
        summary.put("totalRequests", sessionRequestCount.get());
        summary.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);

        final Map<String, Object> toolSummaries = new TreeMap<>();
        toolMetrics.forEach((toolName, metrics) -> {
            final Map<String, Object> toolSummary = new LinkedHashMap<>();
            toolSummary.put("invocations", metrics.invocationCount.get());
            toolSummary.put("successes", metrics.successCount.get());
            toolSummary.put("failures", metrics.failureCount.get());
            toolSummary.put("successRate", successRate(toolName));
            toolSummary.put("avgDurationMs", avgDuration(toolName));
            toolSummary.put("minDurationMs", metrics.minDurationMs.get() == Long.MAX_VALUE ? 0 : metrics.minDurationMs.get());
            toolSummary.put("maxDurationMs", metrics.maxDurationMs.get());
            final Map<String, Long> errors = new TreeMap<>();
            metrics.errorCounts.forEach((type, count) -> errors.put(type, count.get()));
            toolSummary.put("errorTypes", errors);
            toolSummaries.put(toolName, toolSummary);
        });
        summary.put("tools", toolSummaries);

        final Path summaryFile = telemetryDir.resolve("summary_" + today() + ".json");
        try (Writer writer = Files.newBufferedWriter(summaryFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(summary, writer);
            writer.write("\n");
            log.debug("Telemetry summary written to {}", summaryFile);
        } catch (IOException e) {
            log.error("Failed to write telemetry summary {}: {}", summaryFile, e.getMessage());
        }
    }

    /**
     * Log the session end and write the summary.
     */
    public void shutdown() {
        logSessionEvent("SESSION_END", null);
        generateDailySummary();
    }

    Path currentLogFile() {
        return telemetryDir.resolve(LOG_FILE_PREFIX + today() + ".jsonl");
    }

    private void writeEvent(TelemetryEvent event) {
        if (!enabled) {
            return;
        }
        final String line = gson.toJson(event) + "\n";
        try {
            Files.write(currentLogFile(), line.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write telemetry event: {}", e.getMessage());
        }
    }

    private static String today() {
        return DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC));
    }

    private static void recordDuration(ToolMetrics metrics, long duration) {
        metrics.totalDurationMs.addAndGet(duration);
        metrics.minDurationMs.updateAndGet(min -> Math.min(min, duration));
        metrics.maxDurationMs.updateAndGet(max -> Math.max(max, duration));
    }

    private double successRate(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.successCount.get() / metrics.invocationCount.get();
    }

    private double failureRate(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.failureCount.get() / metrics.invocationCount.get();
    }

    private double avgDuration(String toolName) {
        final ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.totalDurationMs.get() / metrics.invocationCount.get();
    }
}

package com.fuzzysentinel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Renders {@link WindowReport}s as JSON or as an aligned text block.
 *
 * <p>
 * JSON timestamps are ISO-8601 strings. Text numbers use three decimals and
 * a dot separator regardless of the default locale.
 * </p>
 */
public class ReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializer.class);

    private final ObjectMapper mapper;

    public ReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public String serialize(WindowReport report, ReportFormat format) {
        Objects.requireNonNull(format, "Report format must not be null");
        return format == ReportFormat.JSON ? toJson(report) : toText(report);
    }

    /**
     * @throws IllegalStateException if Jackson cannot write the report
     */
    public String toJson(WindowReport report) {
        Objects.requireNonNull(report, "Report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize report for window '{}': {}", report.getWindow(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize report for window '" + report.getWindow() + "'", e);
        }
    }

    public String toText(WindowReport report) {
        Objects.requireNonNull(report, "Report must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(capitalize(report.getWindow())).append(" window indicators ===\n");
        line(sb, "Forecast error (EP):", format(report.getForecastError()));
        line(sb, "Variance change (MV):", format(report.getVarianceChange()));
        line(sb, "Correlation change (MC):", format(report.getCorrelationChange()));
        line(sb, "Anomaly level (crisp):", format(report.getScore()));
        line(sb, "Linguistic label:", report.getLabel());
        return sb.toString();
    }

    private static void line(StringBuilder sb, String caption, String value) {
        sb.append(String.format(Locale.ROOT, "%-28s%s%n", caption, value));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return "Unnamed";
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}

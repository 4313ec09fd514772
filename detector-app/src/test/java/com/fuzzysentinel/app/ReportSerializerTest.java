package com.fuzzysentinel.app;

import com.fuzzysentinel.core.model.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportSerializer}.
 */
class ReportSerializerTest {

    private final ReportSerializer serializer = new ReportSerializer();

    private static WindowReport report(String window, double score, String label) {
        return WindowReport.builder()
                .window(window)
                .timestamp(Instant.parse("2026-01-01T12:00:00Z"))
                .forecastError(0.1234)
                .varianceChange(0.5)
                .correlationChange(0.0)
                .score(score)
                .label(label)
                .outcome(Outcome.FIRED)
                .dominantRule("normal_all_low")
                .build();
    }

    @Test
    @DisplayName("Should write ISO-8601 timestamps and enum names in JSON")
    void shouldSerializeJson() {
        String json = serializer.toJson(report("normal", 1.0, "normal"));

        assertThat(json)
                .contains("\"window\":\"normal\"")
                .contains("\"timestamp\":\"2026-01-01T12:00:00Z\"")
                .contains("\"forecastError\":0.1234")
                .contains("\"score\":1.0")
                .contains("\"outcome\":\"FIRED\"")
                .contains("\"dominantRule\":\"normal_all_low\"");
    }

    @Test
    @DisplayName("Should render an aligned text block with three decimals")
    void shouldSerializeText() {
        String text = serializer.toText(report("anomalous", 8.66999, "strongly_anomalous"));

        assertThat(text.lines()).containsExactly(
                "=== Anomalous window indicators ===",
                "Forecast error (EP):        0.123",
                "Variance change (MV):       0.500",
                "Correlation change (MC):    0.000",
                "Anomaly level (crisp):      8.670",
                "Linguistic label:           strongly_anomalous");
    }

    @Test
    @DisplayName("Should pick the renderer from the report format")
    void shouldDispatchOnFormat() {
        WindowReport report = report("normal", 1.0, "normal");

        assertThat(serializer.serialize(report, ReportFormat.JSON)).startsWith("{");
        assertThat(serializer.serialize(report, ReportFormat.TEXT)).startsWith("=== Normal");
    }

    @Test
    @DisplayName("Should separate text reports with a blank line")
    void shouldPrintReports() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        FuzzySentinelApp.print(List.of(report("normal", 1.0, "normal"), report("anomalous", 8.67, "strongly_anomalous")),
                ReportFormat.TEXT, out);

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("=== Normal window indicators ===");
        assertThat(printed).contains("=== Anomalous window indicators ===");
        assertThat(printed.lines().filter(String::isEmpty).count()).isEqualTo(1);
    }
}

package com.fuzzysentinel.app;

import com.fuzzysentinel.core.config.DetectorSettings;
import com.fuzzysentinel.core.config.SettingsLoader;
import com.fuzzysentinel.core.detection.AnomalyDetector;
import com.fuzzysentinel.core.detection.DetectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the Fuzzy Sentinel runner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   AppConfig (environment)
 *     → DetectorSettings (YAML) → AnomalyDetector
 *     → SyntheticSeriesGenerator → baseline, normal window, anomalous window
 *     → WindowScorer → WindowReport per window
 *     → ReportSerializer → stdout
 * </pre>
 *
 * @since 1.0.0
 */
public final class FuzzySentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(FuzzySentinelApp.class);

    private FuzzySentinelApp() {
        // entry-point class
    }

    public static void main(String[] args) {
        // 1. Load configuration
        AppConfig config = AppConfig.fromEnvironment();
        LOG.info("Starting Fuzzy Sentinel with config: {}", config);

        // 2. Build the detector
        AnomalyDetector detector = DetectorFactory.create(loadSettings(config));

        // 3. Score and print
        List<WindowReport> reports = run(config, detector);
        print(reports, config.getReportFormat(), System.out);
    }

    /**
     * Generate the synthetic dataset and score both windows.
     *
     * @return the normal window's report followed by the anomalous one's
     */
    static List<WindowReport> run(AppConfig config, AnomalyDetector detector) {
        SyntheticDataset dataset = new SyntheticSeriesGenerator(config.getSeed())
                .generate(config.getBaselineLength(), config.getWindowLength());

        WindowScorer scorer = new WindowScorer(detector);
        List<WindowReport> reports = new ArrayList<>(2);
        reports.add(scorer.score("normal", dataset.getNormalWindow(), dataset.getBaseline()));
        reports.add(scorer.score("anomalous", dataset.getAnomalousWindow(), dataset.getBaseline()));
        return reports;
    }

    static void print(List<WindowReport> reports, ReportFormat format, PrintStream out) {
        ReportSerializer serializer = new ReportSerializer();
        for (int i = 0; i < reports.size(); i++) {
            if (i > 0 && format == ReportFormat.TEXT) {
                out.println();
            }
            String rendered = serializer.serialize(reports.get(i), format);
            if (format == ReportFormat.TEXT) {
                out.print(rendered);
            } else {
                out.println(rendered);
            }
        }
        out.flush();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorSettings loadSettings(AppConfig config) {
        String settingsPath = config.getDetectorSettingsPath();
        if (settingsPath != null && !settingsPath.isBlank()) {
            return SettingsLoader.fromFile(settingsPath);
        }
        return SettingsLoader.load();
    }
}

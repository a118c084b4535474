package revenue.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data-quality checks on a revenue series. Advisory: findings are logged and reported, never thrown.
 */
public class SeriesValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesValidator.class);

    public static final int DEFAULT_MIN_OBSERVATIONS = 30;
    public static final int DEFAULT_MAX_CONSECUTIVE_ZERO_DAYS = 7;
    /** Maximum tolerated ratio of the largest day to the mean day. */
    public static final double MAX_TO_MEAN_RATIO = 100.0;

    private final int minObservations;
    private final int maxConsecutiveZeroDays;

    public SeriesValidator() {
        this(DEFAULT_MIN_OBSERVATIONS, DEFAULT_MAX_CONSECUTIVE_ZERO_DAYS);
    }

    public SeriesValidator(int minObservations, int maxConsecutiveZeroDays) {
        this.minObservations = minObservations;
        this.maxConsecutiveZeroDays = maxConsecutiveZeroDays;
    }

    public Report validate(TimeSeries series) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("has_data", false);
        checks.put("sufficient_data", false);
        checks.put("no_negative_values", false);
        checks.put("no_excessive_gaps", false);
        checks.put("reasonable_values", false);

        if (series == null || series.size() == 0) {
            LOG.warn("No data provided for validation");
            return new Report(checks, 0);
        }
        checks.put("has_data", true);

        double[] values = series.values();
        // TimeSeries guarantees this already; kept so the report lists every check
        checks.put("no_negative_values", true);

        if (values.length < minObservations) {
            LOG.warn("Insufficient data: {} days (minimum {} required)", values.length, minObservations);
        } else {
            checks.put("sufficient_data", true);
        }

        int longestZeroRun = longestZeroRun(values);
        if (longestZeroRun > maxConsecutiveZeroDays) {
            LOG.warn("Found {} consecutive days with zero revenue", longestZeroRun);
        } else {
            checks.put("no_excessive_gaps", true);
        }

        double max = 0;
        double sum = 0;
        for (double v : values) {
            max = Math.max(max, v);
            sum += v;
        }
        double mean = sum / values.length;
        if (max > mean * MAX_TO_MEAN_RATIO) {
            LOG.warn("Potentially unreasonable max revenue: {}", String.format("%.2f", max));
        } else {
            checks.put("reasonable_values", true);
        }

        Report report = new Report(checks, longestZeroRun);
        LOG.info("Data validation: {}/{} checks passed", report.getPassedCount(), checks.size());
        return report;
    }

    /**
     * Longest run of zero-revenue days. Values at or below the preparation offset count as zero,
     * so prepared and raw series give the same answer.
     */
    static int longestZeroRun(double[] values) {
        int longest = 0;
        int run = 0;
        for (double v : values) {
            if (v <= SeriesPreparer.POSITIVE_OFFSET) {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 0;
            }
        }
        return longest;
    }

    public static final class Report {

        private final Map<String, Boolean> checks;
        private final int longestZeroRun;

        Report(Map<String, Boolean> checks, int longestZeroRun) {
            this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
            this.longestZeroRun = longestZeroRun;
        }

        public Map<String, Boolean> getChecks() { return checks; }
        public int getLongestZeroRun() { return longestZeroRun; }

        public int getPassedCount() {
            return (int) checks.values().stream().filter(Boolean::booleanValue).count();
        }

        public boolean isPassed() {
            return getPassedCount() == checks.size();
        }
    }
}

package revenue.data;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.exception.DataException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw report rows into a clean, gap-free, strictly positive daily series.
 * <p>
 * Steps, in order: sort by date, keep the first row per date, fill missing days and missing values
 * with 0, clip negatives to 0, cap outliers above {@code multiplier x percentile}, then add
 * {@link #POSITIVE_OFFSET} so later log-scale work never sees a zero.
 */
public class SeriesPreparer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesPreparer.class);

    public static final double POSITIVE_OFFSET = 1e-6;
    public static final double DEFAULT_OUTLIER_MULTIPLIER = 10.0;
    public static final double DEFAULT_OUTLIER_PERCENTILE = 95.0;

    private final double outlierMultiplier;
    private final double outlierPercentile;

    public SeriesPreparer() {
        this(DEFAULT_OUTLIER_MULTIPLIER, DEFAULT_OUTLIER_PERCENTILE);
    }

    public SeriesPreparer(double outlierMultiplier, double outlierPercentile) {
        if (!(outlierMultiplier > 0)) throw new IllegalArgumentException("outlier multiplier must be positive");
        if (!(outlierPercentile > 0 && outlierPercentile <= 100)) {
            throw new IllegalArgumentException("outlier percentile must be in (0, 100]");
        }
        this.outlierMultiplier = outlierMultiplier;
        this.outlierPercentile = outlierPercentile;
    }

    /**
     * Prepare a series. A series that is already prepared is returned unchanged, so preparing twice
     * gives the same result as preparing once.
     */
    public PreparedSeries prepare(TimeSeries series) {
        if (series == null) throw new DataException("No series to prepare");
        if (series.isPrepared()) return new PreparedSeries(series, 0, 0, 0, Double.NaN);
        return prepare(series.toObservations());
    }

    public PreparedSeries prepare(List<Observation> rows) {
        if (rows == null || rows.isEmpty()) throw new DataException("No revenue data to prepare");
        for (Observation row : rows) {
            if (row == null || row.getDate() == null) throw new DataException("Every row needs a date");
        }

        // stable sort keeps the original order among equal dates, so the first occurrence survives
        List<Observation> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(Observation::getDate));

        LocalDate first = sorted.get(0).getDate();
        LocalDate last = sorted.get(sorted.size() - 1).getDate();
        int days = Math.toIntExact(ChronoUnit.DAYS.between(first, last) + 1);
        double[] values = new double[days];
        boolean[] seen = new boolean[days];
        int duplicates = 0;
        int filled = 0;
        for (Observation row : sorted) {
            int idx = (int) ChronoUnit.DAYS.between(first, row.getDate());
            if (seen[idx]) {
                duplicates++;
                continue;
            }
            seen[idx] = true;
            Double revenue = row.getRevenue();
            if (revenue == null || Double.isNaN(revenue)) {
                filled++;
                values[idx] = 0;
            } else {
                values[idx] = Math.max(0, revenue);
            }
        }
        for (boolean s : seen) {
            if (!s) filled++;
        }

        double threshold = new Percentile(outlierPercentile)
                .withEstimationType(EstimationType.R_7)
                .evaluate(values) * outlierMultiplier;
        int capped = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > threshold) {
                values[i] = threshold;
                capped++;
            }
            values[i] += POSITIVE_OFFSET;
        }

        if (duplicates > 0) LOG.warn("Dropped {} duplicate dates", duplicates);
        if (filled > 0) LOG.warn("Filled {} missing days or values with zero revenue", filled);
        if (capped > 0) LOG.warn("Found {} outliers, capping at {}", capped, String.format("%.2f", threshold));
        LOG.info("Prepared {} data points for forecasting ({} to {})", days, first, last);
        return new PreparedSeries(TimeSeries.prepared(first, values), capped, filled, duplicates, threshold);
    }
}

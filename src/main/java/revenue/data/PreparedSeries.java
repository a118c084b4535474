package revenue.data;

/** Result of {@link SeriesPreparer#prepare}: the clean series plus what had to be fixed to get it. */
public final class PreparedSeries {

    private final TimeSeries series;
    private final int cappedCount;
    private final int filledCount;
    private final int duplicateCount;
    private final double outlierThreshold;

    PreparedSeries(TimeSeries series, int cappedCount, int filledCount, int duplicateCount, double outlierThreshold) {
        this.series = series;
        this.cappedCount = cappedCount;
        this.filledCount = filledCount;
        this.duplicateCount = duplicateCount;
        this.outlierThreshold = outlierThreshold;
    }

    public TimeSeries getSeries() { return series; }

    /** Values that exceeded the outlier threshold and were capped at it. */
    public int getCappedCount() { return cappedCount; }

    /** Missing days and missing revenue values that were filled with zero. */
    public int getFilledCount() { return filledCount; }

    /** Rows dropped because an earlier row had the same date. */
    public int getDuplicateCount() { return duplicateCount; }

    /** Cap applied to outliers; {@code NaN} for an already prepared input. */
    public double getOutlierThreshold() { return outlierThreshold; }
}

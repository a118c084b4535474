package revenue.ml;

import java.time.LocalDate;

/** One forecast day: point estimate and symmetric confidence bounds. */
public final class ForecastPoint {

    private final LocalDate date;
    private final double mean;
    private final double lowerBound;
    private final double upperBound;

    public ForecastPoint(LocalDate date, double mean, double lowerBound, double upperBound) {
        this.date = date;
        this.mean = mean;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public LocalDate getDate() { return date; }
    public double getMean() { return mean; }
    public double getLowerBound() { return lowerBound; }
    public double getUpperBound() { return upperBound; }

    public double getWidth() {
        return upperBound - lowerBound;
    }

    @Override
    public String toString() {
        return String.format("%s %.4f [%.4f, %.4f]", date, mean, lowerBound, upperBound);
    }
}

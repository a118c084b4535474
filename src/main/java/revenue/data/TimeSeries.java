package revenue.data;

import revenue.exception.DataException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable daily revenue series.
 * <p>
 * One value per calendar day starting at {@link #getFirstDate()}: dates are strictly increasing with
 * no gaps and every value is finite and non-negative. Because the index is gap-free it is stored as a
 * start date plus a value array.
 */
public final class TimeSeries {

    private final LocalDate firstDate;
    private final double[] values;
    private final boolean prepared;

    private TimeSeries(LocalDate firstDate, double[] values, boolean prepared) {
        this.firstDate = firstDate;
        this.values = values;
        this.prepared = prepared;
    }

    /**
     * Daily series starting at {@code firstDate}.
     *
     * @throws DataException if the series is empty or a value is negative or not finite
     */
    public static TimeSeries daily(LocalDate firstDate, double[] values) {
        return create(firstDate, values, false);
    }

    static TimeSeries prepared(LocalDate firstDate, double[] values) {
        return create(firstDate, values, true);
    }

    private static TimeSeries create(LocalDate firstDate, double[] values, boolean prepared) {
        if (firstDate == null) throw new DataException("Series start date is required");
        if (values == null || values.length == 0) throw new DataException("Series must contain at least one value");
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i]) || values[i] < 0) {
                throw new DataException("Invalid value " + values[i] + " on " + firstDate.plusDays(i));
            }
        }
        return new TimeSeries(firstDate, values.clone(), prepared);
    }

    public int size() { return values.length; }
    public LocalDate getFirstDate() { return firstDate; }
    public LocalDate getLastDate() { return firstDate.plusDays(values.length - 1L); }

    /** True when the series came out of {@link SeriesPreparer}. */
    public boolean isPrepared() { return prepared; }

    public LocalDate date(int i) {
        checkIndex(i);
        return firstDate.plusDays(i);
    }

    public double value(int i) {
        checkIndex(i);
        return values[i];
    }

    /** Copy of the values in date order. */
    public double[] values() {
        return values.clone();
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) out.add(firstDate.plusDays(i));
        return out;
    }

    /** The first {@code n} days. */
    public TimeSeries head(int n) {
        if (n < 1 || n > values.length) throw new IllegalArgumentException("head size out of range: " + n);
        return new TimeSeries(firstDate, Arrays.copyOf(values, n), prepared);
    }

    /** The last {@code n} days. */
    public TimeSeries tail(int n) {
        if (n < 1 || n > values.length) throw new IllegalArgumentException("tail size out of range: " + n);
        return new TimeSeries(firstDate.plusDays(values.length - n), Arrays.copyOfRange(values, values.length - n, values.length), prepared);
    }

    public List<Observation> toObservations() {
        List<Observation> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) out.add(Observation.of(firstDate.plusDays(i), values[i]));
        return out;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= values.length) throw new IndexOutOfBoundsException("Index " + i + " of " + values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries)) return false;
        TimeSeries that = (TimeSeries) o;
        return prepared == that.prepared && firstDate.equals(that.firstDate) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * firstDate.hashCode() + Arrays.hashCode(values)) + Boolean.hashCode(prepared);
    }

    @Override
    public String toString() {
        return "TimeSeries[" + firstDate + ".." + getLastDate() + ", n=" + values.length + (prepared ? ", prepared" : "") + "]";
    }
}

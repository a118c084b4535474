package revenue.data;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One raw row of a daily revenue report, as handed over by the data-retrieval side.
 * The revenue may be missing ({@code null}) or negative; {@link SeriesPreparer} cleans it up.
 */
public final class Observation {

    private final LocalDate date;
    private final Double revenue;

    public Observation(LocalDate date, Double revenue) {
        this.date = date;
        this.revenue = revenue;
    }

    public static Observation of(LocalDate date, double revenue) {
        return new Observation(date, revenue);
    }

    public LocalDate getDate() { return date; }
    public Double getRevenue() { return revenue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation)) return false;
        Observation that = (Observation) o;
        return Objects.equals(date, that.date) && Objects.equals(revenue, that.revenue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, revenue);
    }

    @Override
    public String toString() {
        return date + "=" + revenue;
    }
}

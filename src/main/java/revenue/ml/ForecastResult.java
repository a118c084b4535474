package revenue.ml;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast rows for consecutive days following the last observed date, in date order.
 */
public final class ForecastResult {

    private final List<ForecastPoint> points;
    private final double confidenceLevel;

    ForecastResult(List<ForecastPoint> points, double confidenceLevel) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.confidenceLevel = confidenceLevel;
    }

    public List<ForecastPoint> getPoints() { return points; }
    public double getConfidenceLevel() { return confidenceLevel; }

    public int size() {
        return points.size();
    }

    public LocalDate getFirstDate() {
        return points.get(0).getDate();
    }

    public LocalDate getLastDate() {
        return points.get(points.size() - 1).getDate();
    }

    public double[] means() {
        return points.stream().mapToDouble(ForecastPoint::getMean).toArray();
    }

    /** Point forecasts keyed by date, for aligning with actuals. */
    public Map<LocalDate, Double> meansByDate() {
        Map<LocalDate, Double> out = new HashMap<>();
        for (ForecastPoint point : points) out.put(point.getDate(), point.getMean());
        return out;
    }

    /** Rows in the output contract shape: date, forecast, lower_ci, upper_ci. */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> rows = new ArrayList<>(points.size());
        for (ForecastPoint point : points) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", point.getDate().toString());
            row.put("forecast", point.getMean());
            row.put("lower_ci", point.getLowerBound());
            row.put("upper_ci", point.getUpperBound());
            rows.add(row);
        }
        return rows;
    }
}

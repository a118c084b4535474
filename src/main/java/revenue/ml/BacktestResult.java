package revenue.ml;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of one holdout backtest. */
public final class BacktestResult {

    private final LocalDate trainStart;
    private final LocalDate trainEnd;
    private final LocalDate testStart;
    private final LocalDate testEnd;
    private final ForecastResult forecast;
    private final BacktestMetrics metrics;

    BacktestResult(LocalDate trainStart, LocalDate trainEnd, LocalDate testStart, LocalDate testEnd,
                   ForecastResult forecast, BacktestMetrics metrics) {
        this.trainStart = trainStart;
        this.trainEnd = trainEnd;
        this.testStart = testStart;
        this.testEnd = testEnd;
        this.forecast = forecast;
        this.metrics = metrics;
    }

    public LocalDate getTrainStart() { return trainStart; }
    public LocalDate getTrainEnd() { return trainEnd; }
    public LocalDate getTestStart() { return testStart; }
    public LocalDate getTestEnd() { return testEnd; }
    public ForecastResult getForecast() { return forecast; }
    public BacktestMetrics getMetrics() { return metrics; }

    /** "yyyy-MM-dd to yyyy-MM-dd" */
    public String getTestPeriod() {
        return testStart + " to " + testEnd;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("train_start", trainStart.toString());
        out.put("train_end", trainEnd.toString());
        out.put("test_start", testStart.toString());
        out.put("test_end", testEnd.toString());
        out.put("test_period", getTestPeriod());
        out.put("metrics", metrics.toMap());
        out.put("forecast", forecast.toRows());
        return out;
    }
}

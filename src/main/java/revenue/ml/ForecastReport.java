package revenue.ml;

import revenue.data.PreparedSeries;
import revenue.data.SeriesSummary;
import revenue.data.SeriesValidator;
import revenue.exception.BacktestException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one {@link RevenueForecaster#run} produced. The backtest is optional: it is absent when
 * not requested, and when requested but impossible the failure is kept instead.
 */
public final class ForecastReport {

    private final PreparedSeries prepared;
    private final SeriesSummary summary;
    private final SeriesValidator.Report validation;
    private final StationarityResult stationarity;
    private final FittedModel model;
    private final ForecastResult forecast;
    private final ModelDiagnostics diagnostics;
    private final Map<String, Double> parameterImportance;
    private final BacktestResult backtest;
    private final BacktestException backtestFailure;

    ForecastReport(PreparedSeries prepared, SeriesSummary summary, SeriesValidator.Report validation,
                   StationarityResult stationarity, FittedModel model, ForecastResult forecast,
                   ModelDiagnostics diagnostics, Map<String, Double> parameterImportance,
                   BacktestResult backtest, BacktestException backtestFailure) {
        this.prepared = prepared;
        this.summary = summary;
        this.validation = validation;
        this.stationarity = stationarity;
        this.model = model;
        this.forecast = forecast;
        this.diagnostics = diagnostics;
        this.parameterImportance = Collections.unmodifiableMap(new LinkedHashMap<>(parameterImportance));
        this.backtest = backtest;
        this.backtestFailure = backtestFailure;
    }

    public PreparedSeries getPrepared() { return prepared; }
    public SeriesSummary getSummary() { return summary; }
    public SeriesValidator.Report getValidation() { return validation; }
    public StationarityResult getStationarity() { return stationarity; }
    public FittedModel getModel() { return model; }
    public ForecastResult getForecast() { return forecast; }
    public ModelDiagnostics getDiagnostics() { return diagnostics; }

    /** {@code parameter_i} to the absolute value of the i-th fitted parameter. */
    public Map<String, Double> getParameterImportance() { return parameterImportance; }

    /** {@code null} unless a backtest was requested and succeeded. */
    public BacktestResult getBacktest() { return backtest; }

    /** {@code null} unless a backtest was requested and failed. */
    public BacktestException getBacktestFailure() { return backtestFailure; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("summary", summary.toMap());
        out.put("validation", validation.getChecks());
        out.put("stationarity", stationarity.toMap());
        out.put("diagnostics", diagnostics.toMap());
        out.put("parameter_importance", parameterImportance);
        out.put("forecast", forecast.toRows());
        if (backtest != null) out.put("backtest", backtest.toMap());
        if (backtestFailure != null) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", backtestFailure.getErrorCode());
            error.put("message", backtestFailure.getMessage());
            out.put("backtest", error);
        }
        return out;
    }
}

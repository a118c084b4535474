package revenue.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.ForecastSettings;
import revenue.data.Observation;
import revenue.data.PreparedSeries;
import revenue.data.SeriesPreparer;
import revenue.data.SeriesSummary;
import revenue.data.SeriesValidator;
import revenue.data.TimeSeries;
import revenue.exception.BacktestException;

import java.util.List;
import java.util.Objects;

/**
 * The full forecasting run over raw revenue rows: prepare, check, fit, forecast, diagnose and
 * optionally backtest.
 * <p>
 * Orders come from the settings. When they are not a valid (p,d,q) and (P,D,Q,s) the non-seasonal
 * order is searched by AIC instead and paired with the default weekly seasonal order.
 */
public class RevenueForecaster {

    private static final Logger LOG = LoggerFactory.getLogger(RevenueForecaster.class);

    /** Seasonal order paired with an auto-selected non-seasonal order. */
    public static final SeasonalOrder FALLBACK_SEASONAL_ORDER = SeasonalOrder.of(1, 1, 1, SeasonalOrder.DEFAULT_PERIOD);

    private final ForecastSettings settings;
    private final SeriesPreparer preparer;
    private final SeriesValidator validator;
    private final StationarityAnalyzer stationarityAnalyzer;
    private final SarimaEstimator estimator;
    private final OrderSelector orderSelector;
    private final Forecaster forecaster;
    private final DiagnosticsReporter diagnosticsReporter;

    public RevenueForecaster(ForecastSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.preparer = new SeriesPreparer(settings.getOutlierMultiplier(), settings.getOutlierPercentile());
        this.validator = new SeriesValidator(settings.getMinObservations(), settings.getMaxConsecutiveZeroDays());
        this.stationarityAnalyzer = new StationarityAnalyzer();
        this.estimator = new SarimaEstimator(settings.getMinObservations(), settings.getMaxIterations());
        this.orderSelector = new OrderSelector(estimator);
        this.forecaster = new Forecaster();
        this.diagnosticsReporter = new DiagnosticsReporter();
    }

    public ForecastSettings getSettings() { return settings; }

    /** Forecast with the configured horizon and no backtest. */
    public ForecastReport run(List<Observation> rows) {
        return run(rows, settings.getDefaultForecastDays(), 0, ProgressListener.NONE);
    }

    /**
     * @param forecastDays  days to forecast past the last observed date
     * @param backtestDays  holdout window in days, rounded down to whole 30-day months (at least one);
     *                      0 or less skips the backtest
     * @throws revenue.exception.DataException if the rows cannot be prepared
     * @throws revenue.exception.ModelFitException if the model cannot be fit on the full series
     */
    public ForecastReport run(List<Observation> rows, int forecastDays, int backtestDays, ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        progress.onStage(ProgressListener.PREPARING);
        PreparedSeries prepared = preparer.prepare(rows);
        TimeSeries series = prepared.getSeries();
        SeriesValidator.Report validation = validator.validate(series);
        SeriesSummary summary = SeriesSummary.of(series);
        StationarityResult stationarity = stationarityAnalyzer.analyze(series.values());

        progress.onStage(ProgressListener.FITTING);
        FittedModel model = fit(series);

        progress.onStage(ProgressListener.FORECASTING);
        ForecastResult forecast = forecaster.forecast(model, forecastDays, settings.getConfidenceInterval());
        ModelDiagnostics diagnostics = diagnosticsReporter.report(model);

        BacktestResult backtest = null;
        BacktestException backtestFailure = null;
        if (backtestDays > 0) {
            progress.onStage(ProgressListener.BACKTESTING);
            int months = Math.max(1, backtestDays / Backtester.DAYS_PER_MONTH);
            Backtester backtester = new Backtester(preparer, estimator, forecaster,
                    model.getOrder(), model.getSeasonalOrder(), settings.getMinObservations());
            try {
                backtest = backtester.backtest(series, Backtester.daysForMonths(months));
            } catch (BacktestException e) {
                LOG.warn("Backtest skipped: {}", e.getMessage());
                backtestFailure = e;
            }
        }
        return new ForecastReport(prepared, summary, validation, stationarity, model, forecast, diagnostics,
                diagnosticsReporter.parameterImportance(model), backtest, backtestFailure);
    }

    /** Fit with the configured orders, or with searched ones when the configuration is invalid. */
    public FittedModel fit(TimeSeries series) {
        Orders orders = resolveOrders(series);
        return estimator.fit(series, orders.order, orders.seasonal);
    }

    /**
     * Holdout backtest of the configured (or searched) orders over the last {@code testDays} days.
     *
     * @throws BacktestException if the window leaves too little training data or the fit fails
     */
    public BacktestResult backtest(List<Observation> rows, int testDays) {
        TimeSeries series = preparer.prepare(rows).getSeries();
        Orders orders = resolveOrders(series);
        return new Backtester(preparer, estimator, forecaster, orders.order, orders.seasonal,
                settings.getMinObservations()).backtest(series, testDays);
    }

    private Orders resolveOrders(TimeSeries series) {
        ModelOrder order = OrderValidation.toOrder(settings.getSarimaOrder());
        SeasonalOrder seasonal = OrderValidation.toSeasonalOrder(settings.getSeasonalOrder());
        if (order != null && seasonal != null) return new Orders(order, seasonal);
        LOG.warn("Invalid SARIMA parameters {} x {}, using auto-selection",
                settings.getSarimaOrder(), settings.getSeasonalOrder());
        ModelOrder selected = orderSelector.select(series.values(), settings.getMaxP(), settings.getMaxD(), settings.getMaxQ());
        return new Orders(selected, FALLBACK_SEASONAL_ORDER);
    }

    private static final class Orders {
        final ModelOrder order;
        final SeasonalOrder seasonal;

        Orders(ModelOrder order, SeasonalOrder seasonal) {
            this.order = order;
            this.seasonal = seasonal;
        }
    }
}

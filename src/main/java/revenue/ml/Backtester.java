package revenue.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.data.SeriesPreparer;
import revenue.data.TimeSeries;
import revenue.exception.BacktestException;
import revenue.exception.ModelFitException;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Holdout backtest: hide the most recent days, fit a fresh model on everything before them,
 * forecast the hidden days and score the forecast against what actually happened.
 */
public class Backtester {

    private static final Logger LOG = LoggerFactory.getLogger(Backtester.class);

    /** Months are approximated as 30 days when a window is given in months. */
    public static final int DAYS_PER_MONTH = 30;
    public static final int DEFAULT_MIN_TRAINING_DAYS = 30;

    private final SeriesPreparer preparer;
    private final SarimaEstimator estimator;
    private final Forecaster forecaster;
    private final ModelOrder order;
    private final SeasonalOrder seasonalOrder;
    private final int minTrainingDays;

    public Backtester(SeriesPreparer preparer, SarimaEstimator estimator, Forecaster forecaster,
                      ModelOrder order, SeasonalOrder seasonalOrder) {
        this(preparer, estimator, forecaster, order, seasonalOrder, DEFAULT_MIN_TRAINING_DAYS);
    }

    public Backtester(SeriesPreparer preparer, SarimaEstimator estimator, Forecaster forecaster,
                      ModelOrder order, SeasonalOrder seasonalOrder, int minTrainingDays) {
        this.preparer = Objects.requireNonNull(preparer, "preparer");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster");
        this.order = Objects.requireNonNull(order, "order");
        this.seasonalOrder = Objects.requireNonNull(seasonalOrder, "seasonalOrder");
        this.minTrainingDays = minTrainingDays;
    }

    /** Test window length for a number of months. */
    public static int daysForMonths(int months) {
        if (months < 1) throw new IllegalArgumentException("months must be positive: " + months);
        return months * DAYS_PER_MONTH;
    }

    /**
     * @param testDays length of the holdout window in days
     * @throws BacktestException if fewer than the minimum training days remain, the training fit
     * fails, or no forecast day lines up with an actual value
     */
    public BacktestResult backtest(TimeSeries series, int testDays) {
        if (testDays < 1) throw new IllegalArgumentException("Test window must be at least 1 day: " + testDays);
        TimeSeries prepared = preparer.prepare(series).getSeries();

        int trainDays = prepared.size() - testDays;
        if (trainDays < minTrainingDays) {
            throw new BacktestException("insufficient training data: " + Math.max(trainDays, 0)
                    + " days before a " + testDays + "-day test window (minimum " + minTrainingDays + ")");
        }
        TimeSeries train = prepared.head(trainDays);
        TimeSeries test = prepared.tail(testDays);
        LOG.info("Backtesting: {} training days, {} test days", train.size(), test.size());

        FittedModel model;
        try {
            model = estimator.fit(train, order, seasonalOrder);
        } catch (ModelFitException e) {
            throw new BacktestException("Failed to fit model for backtesting: " + e.getMessage(), e);
        }
        ForecastResult forecast = forecaster.forecast(model, test.size());

        // align by date and keep only pairs where both values are defined
        Map<LocalDate, Double> predicted = forecast.meansByDate();
        double[] actual = new double[test.size()];
        double[] fitted = new double[test.size()];
        int pairs = 0;
        for (int i = 0; i < test.size(); i++) {
            Double f = predicted.get(test.date(i));
            double a = test.value(i);
            if (f == null || !Double.isFinite(f) || !Double.isFinite(a)) continue;
            actual[pairs] = a;
            fitted[pairs] = f;
            pairs++;
        }
        if (pairs == 0) throw new BacktestException("No valid data points for backtesting");

        BacktestMetrics metrics = BacktestMetrics.of(Arrays.copyOf(actual, pairs), Arrays.copyOf(fitted, pairs));
        LOG.info("Backtesting completed. RMSE: {}, MAE: {}, MAPE: {}%",
                String.format("%.2f", metrics.getRmse()), String.format("%.2f", metrics.getMae()),
                String.format("%.2f", metrics.getMape()));
        return new BacktestResult(train.getFirstDate(), train.getLastDate(), test.getFirstDate(), test.getLastDate(),
                forecast, metrics);
    }
}

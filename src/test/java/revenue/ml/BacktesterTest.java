package revenue.ml;

import org.junit.jupiter.api.Test;
import revenue.data.SeriesPreparer;
import revenue.data.TimeSeries;
import revenue.exception.BacktestException;
import revenue.exception.ModelFitException;

import static org.assertj.core.api.Assertions.*;

class BacktesterTest {

    private static Backtester backtester(int minTrainingDays) {
        return new Backtester(new SeriesPreparer(), new SarimaEstimator(), new Forecaster(),
            ModelOrder.of(1, 1, 1), SeasonalOrder.none(), minTrainingDays);
    }

    @Test
    void ninetyDayWindowOnHundredDaysLeavesTooLittleTraining() {
        TimeSeries series = SyntheticSeries.dailyRevenue(2, 100);

        assertThatThrownBy(() -> backtester(30).backtest(series, 90))
            .isInstanceOf(BacktestException.class)
            .hasMessageContaining("insufficient training data");
    }

    @Test
    void scoresTheHeldOutDays() {
        TimeSeries series = SyntheticSeries.dailyRevenue(2, 150);

        BacktestResult result = backtester(30).backtest(series, 30);

        assertThat(result.getTrainStart()).isEqualTo(series.getFirstDate());
        assertThat(result.getTestStart()).isEqualTo(result.getTrainEnd().plusDays(1));
        assertThat(result.getTestEnd()).isEqualTo(series.getLastDate());
        assertThat(result.getTestPeriod()).isEqualTo(result.getTestStart() + " to " + series.getLastDate());
        assertThat(result.getForecast().size()).isEqualTo(30);

        BacktestMetrics metrics = result.getMetrics();
        assertThat(metrics.getPairs()).isEqualTo(30);
        assertThat(metrics.getMae()).isGreaterThanOrEqualTo(0);
        assertThat(metrics.getRmse()).isGreaterThanOrEqualTo(metrics.getMae());
        assertThat(metrics.getMape()).isGreaterThanOrEqualTo(0).isLessThan(100);
    }

    @Test
    void trainingFitFailureIsReportedAsBacktestFailure() {
        TimeSeries series = SyntheticSeries.dailyRevenue(2, 40);

        assertThatThrownBy(() -> backtester(5).backtest(series, 30))
            .isInstanceOf(BacktestException.class)
            .hasMessageContaining("Failed to fit model")
            .hasCauseInstanceOf(ModelFitException.class);
    }

    @Test
    void monthsAreThirtyDays() {
        assertThat(Backtester.daysForMonths(1)).isEqualTo(30);
        assertThat(Backtester.daysForMonths(3)).isEqualTo(90);
        assertThatThrownBy(() -> Backtester.daysForMonths(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

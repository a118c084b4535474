package revenue.ml;

import org.junit.jupiter.api.Test;
import revenue.data.TimeSeries;
import revenue.exception.ModelFitException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class SarimaEstimatorTest {

    private final SarimaEstimator estimator = new SarimaEstimator();

    @Test
    void constantSeriesWithRandomWalkOrderForecastsTheConstant() {
        TimeSeries series = SyntheticSeries.constant(60, 100);

        FittedModel model = estimator.fit(series, ModelOrder.of(0, 1, 0), SeasonalOrder.of(0, 0, 0, 7));
        ForecastResult forecast = new Forecaster().forecast(model, 30);

        assertThat(Double.isFinite(model.getAic())).isTrue();
        for (double mean : forecast.means()) {
            assertThat(mean).isCloseTo(100, within(1e-6));
        }
    }

    @Test
    void tenObservationsAreNotEnough() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2024, 1, 1), new double[]{5, 6, 5, 7, 8, 6, 5, 4, 6, 7});

        assertThatThrownBy(() -> estimator.fit(series, ModelOrder.of(1, 1, 1), SeasonalOrder.none()))
            .isInstanceOf(ModelFitException.class)
            .hasMessageContaining("insufficient observations");
    }

    @Test
    void differencingMustLeaveEnoughObservations() {
        double[] values = SyntheticSeries.dailyRevenue(3, 30).values();

        assertThatThrownBy(() -> estimator.estimate(values, ModelOrder.of(0, 0, 0), SeasonalOrder.of(0, 2, 0, 15)))
            .isInstanceOf(ModelFitException.class)
            .hasMessageContaining("after differencing");
    }

    @Test
    void nonFiniteValuesAreRejected() {
        double[] values = SyntheticSeries.ar2(1, 40, 0.5, 0);
        values[20] = Double.NaN;

        assertThatThrownBy(() -> estimator.estimate(values, ModelOrder.of(1, 0, 0), SeasonalOrder.none()))
            .isInstanceOf(ModelFitException.class);
    }

    @Test
    void recoversAr2Coefficients() {
        double[] y = SyntheticSeries.ar2(7, 400, 1.3, -0.8);

        Estimation estimation = estimator.estimate(y, ModelOrder.of(2, 0, 0), SeasonalOrder.none());

        assertThat(estimation.getCoefficients()[0]).isCloseTo(1.3, within(0.1));
        assertThat(estimation.getCoefficients()[1]).isCloseTo(-0.8, within(0.1));
        assertThat(estimation.getSigma2()).isCloseTo(1.0, within(0.2));
        assertThat(estimation.getEffectiveObservations()).isEqualTo(400);
    }

    @Test
    void conditioningScoresEveryDifferencingOrderOnTheSameObservations() {
        double[] y = SyntheticSeries.ar2(5, 200, 0.5, 0.3);

        Estimation levels = estimator.estimate(y, ModelOrder.of(1, 0, 0), SeasonalOrder.none(), 2);
        Estimation differenced = estimator.estimate(y, ModelOrder.of(1, 2, 0), SeasonalOrder.none(), 2);

        assertThat(levels.getEffectiveObservations()).isEqualTo(198);
        assertThat(differenced.getEffectiveObservations()).isEqualTo(198);
        assertThat(levels.getResiduals()).hasSize(200);
        assertThat(differenced.getResiduals()).hasSize(198);
        assertThatThrownBy(() -> estimator.estimate(y, ModelOrder.of(1, 0, 0), SeasonalOrder.none(), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exactAr2FitReachesTheScaledVarianceFloor() {
        double[] y = SyntheticSeries.noiseFreeAr2(200, 0.5, 0.3);

        Estimation estimation = estimator.estimate(y, ModelOrder.of(2, 0, 0), SeasonalOrder.none(), 2);

        assertThat(estimation.getCoefficients()[0]).isCloseTo(0.5, within(1e-6));
        assertThat(estimation.getCoefficients()[1]).isCloseTo(0.3, within(1e-6));
        assertThat(estimation.getSigma2()).isEqualTo(SarimaEstimator.sigma2Floor(y));
        assertThat(SarimaEstimator.sigma2Floor(y)).isGreaterThan(SarimaEstimator.MIN_SIGMA2);
    }

    @Test
    void refittingTheSameDataGivesTheSameCriteria() {
        TimeSeries series = SyntheticSeries.dailyRevenue(11, 120);
        ModelOrder order = ModelOrder.of(1, 1, 1);
        SeasonalOrder seasonal = SeasonalOrder.of(1, 1, 1, 7);

        FittedModel first = estimator.fit(series, order, seasonal);
        FittedModel second = estimator.fit(series, order, seasonal);

        assertThat(second.getAic()).isEqualTo(first.getAic());
        assertThat(second.getBic()).isEqualTo(first.getBic());
        assertThat(second.getParameters()).containsExactly(first.getParameters());
    }

    @Test
    void seasonalModelReportsItsParameters() {
        TimeSeries series = SyntheticSeries.dailyRevenue(11, 120);

        FittedModel model = estimator.fit(series, ModelOrder.of(1, 1, 1), SeasonalOrder.of(1, 1, 1, 7));

        // φ, θ, Φ, Θ and σ²
        assertThat(model.getParameters()).hasSize(5);
        assertThat(model.getSigma2()).isPositive();
        assertThat(model.getEffectiveObservations()).isEqualTo(120 - 1 - 7);
        assertThat(model.getResiduals()).hasSize(112);
        assertThat(model.getBic()).isGreaterThan(model.getAic());
        assertThat(model.getSeries()).isSameAs(series);
    }
}

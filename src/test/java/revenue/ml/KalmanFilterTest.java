package revenue.ml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KalmanFilterTest {

    private static final double[] NO_MA = new double[0];

    @Test
    void detectsStationaryAutoregressions() {
        assertThat(new KalmanFilter(new double[]{0.5}, NO_MA).isStationary()).isTrue();
        assertThat(new KalmanFilter(new double[]{1.3, -0.8}, NO_MA).isStationary()).isTrue();
        assertThat(new KalmanFilter(new double[0], NO_MA).isStationary()).isTrue();

        assertThat(new KalmanFilter(new double[]{1.0}, NO_MA).isStationary()).isFalse();
        assertThat(new KalmanFilter(new double[]{0.5, 0.6}, NO_MA).isStationary()).isFalse();
        assertThat(new KalmanFilter(new double[]{1, 0, 0, 0, 0, 0, 1, -1}, NO_MA).isStationary()).isFalse();
    }

    @Test
    void stationaryCovarianceOfAr1() {
        double[][] p = new KalmanFilter(new double[]{0.6}, NO_MA).stationaryCovariance();

        assertThat(p[0][0]).isCloseTo(1 / (1 - 0.36), within(1e-9));
    }

    @Test
    void stationaryCovarianceOfMa1() {
        // Var(y) = 1 + θ²
        double[][] p = new KalmanFilter(new double[0], new double[]{0.5}).stationaryCovariance();

        assertThat(p[0][0]).isCloseTo(1.25, within(1e-12));
    }

    @Test
    void noStationaryCovarianceForUnitRoot() {
        assertThat(new KalmanFilter(new double[]{1.0}, NO_MA).stationaryCovariance()).isNull();
    }

    @Test
    void ar1PredictionErrorsAreExactAfterTheFirstObservation() {
        KalmanFilter filter = new KalmanFilter(new double[]{0.5}, NO_MA);
        double[] y = {2, 3, -1, 0.5};

        KalmanFilter.Run run = filter.filter(y, filter.stationaryCovariance());

        assertThat(run.getInnovations()).containsExactly(new double[]{2, 2, -2.5, 1}, within(1e-12));
        assertThat(run.getVariances()[0]).isCloseTo(4.0 / 3, within(1e-12));
        assertThat(run.getVariances()[3]).isCloseTo(1, within(1e-12));
    }

    @Test
    void extendedVariancesAccumulate() {
        KalmanFilter filter = new KalmanFilter(new double[]{0.5}, NO_MA);
        KalmanFilter.Run run = filter.filter(new double[]{1, 2, 3}, filter.stationaryCovariance());

        double[][] ahead = filter.extend(run, 3);

        assertThat(ahead[0]).containsExactly(new double[]{1.5, 0.75, 0.375}, within(1e-12));
        assertThat(ahead[1]).containsExactly(new double[]{1, 1.25, 1.3125}, within(1e-12));
    }
}

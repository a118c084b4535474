package revenue.ml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SeasonalDecomposerTest {

    private static final double[] WEEKLY = {3, -1, -1, -1, 0, 0, 0};

    @Test
    void separatesLinearTrendFromWeeklyPattern() {
        double[] x = new double[28];
        for (int i = 0; i < x.length; i++) x[i] = 10 + 0.5 * i + WEEKLY[i % 7];

        SeasonalDecomposer.Decomposition result = new SeasonalDecomposer(7).decompose(x);

        double[] trend = result.getTrend();
        assertThat(trend[0]).isNaN();
        assertThat(trend[27]).isNaN();
        for (int i = 3; i < 25; i++) {
            assertThat(trend[i]).isCloseTo(10 + 0.5 * i, within(1e-9));
            assertThat(result.getResidual()[i]).isCloseTo(0, within(1e-9));
        }
        for (int i = 0; i < 7; i++) {
            assertThat(result.getSeasonal()[i]).isCloseTo(WEEKLY[i], within(1e-9));
        }
        assertThat(result.getObserved()).containsExactly(x);
    }

    @Test
    void evenPeriodUsesCenteredAverage() {
        double[] x = new double[16];
        for (int i = 0; i < x.length; i++) x[i] = 2 * i + (i % 4 == 0 ? 4 : 0);

        SeasonalDecomposer.Decomposition result = new SeasonalDecomposer(4).decompose(x);

        // the 2x4 average of a period-4 pattern with mean 1 is the line plus 1
        assertThat(result.getTrend()[6]).isCloseTo(2 * 6 + 1, within(1e-9));
    }

    @Test
    void needsTwoFullPeriods() {
        assertThatThrownBy(() -> new SeasonalDecomposer(7).decompose(new double[13]))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SeasonalDecomposer(1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package revenue.ml;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class StationarityAnalyzerTest {

    private final StationarityAnalyzer analyzer = new StationarityAnalyzer();

    @Test
    void whiteNoiseIsStationary() {
        StationarityResult result = analyzer.analyze(SyntheticSeries.whiteNoise(7, 300));

        assertThat(result.isAdfStationary()).isTrue();
        assertThat(result.isKpssStationary()).isTrue();
        assertThat(result.isStationary()).isTrue();
        assertThat(result.getAdfCriticalValue()).isCloseTo(-2.87, within(0.01));
        assertThat(result.getKpssCriticalValue()).isEqualTo(0.463);
    }

    @Test
    void randomWalkIsNotStationary() {
        StationarityResult result = analyzer.analyze(SyntheticSeries.randomWalk(7, 300));

        assertThat(result.isAdfStationary()).isFalse();
        assertThat(result.isKpssStationary()).isFalse();
        assertThat(result.isStationary()).isFalse();
    }

    @Test
    void constantSeriesIsInconclusive() {
        double[] flat = new double[50];
        Arrays.fill(flat, 3);

        StationarityResult result = analyzer.analyze(flat);

        assertThat(result.isStationary()).isFalse();
        assertThat(result.getAdfStatistic()).isNaN();
    }

    @Test
    void shortSeriesIsInconclusive() {
        assertThat(analyzer.analyze(new double[]{1, 2, 3}).getKpssStatistic()).isNaN();
    }

    @Test
    void kpssOfTrendingSeriesIsLarge() {
        double[] trend = new double[100];
        for (int i = 0; i < trend.length; i++) trend[i] = i;

        assertThat(StationarityAnalyzer.kpss(trend)).isGreaterThan(StationarityAnalyzer.KPSS_CRITICAL_5PCT);
    }

    @Test
    void straightLineStillGetsKpssWhenAdfRegressionIsSingular() {
        double[] line = new double[100];
        for (int i = 0; i < line.length; i++) line[i] = 5 + 2 * i;

        StationarityResult result = analyzer.analyze(line);

        assertThat(result.getAdfStatistic()).isNaN();
        assertThat(result.isAdfStationary()).isFalse();
        assertThat(result.getKpssStatistic()).isGreaterThan(StationarityAnalyzer.KPSS_CRITICAL_5PCT);
        assertThat(result.isKpssStationary()).isFalse();
        assertThat(result.isStationary()).isFalse();
    }

    @Test
    void resultMapUsesReportFieldNames() {
        assertThat(analyzer.analyze(SyntheticSeries.whiteNoise(7, 100)).toMap())
            .containsKeys("is_stationary", "adf_statistic", "kpss_statistic");
    }
}

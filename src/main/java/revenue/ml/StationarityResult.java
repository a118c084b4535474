package revenue.ml;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the ADF and KPSS tests. The two tests have opposite null hypotheses, so a series is
 * called stationary only when ADF rejects a unit root and KPSS does not reject stationarity.
 */
public final class StationarityResult {

    private final boolean adfStationary;
    private final boolean kpssStationary;
    private final double adfStatistic;
    private final double adfCriticalValue;
    private final int adfLags;
    private final double kpssStatistic;
    private final double kpssCriticalValue;

    StationarityResult(boolean adfStationary, boolean kpssStationary, double adfStatistic, double adfCriticalValue,
                       int adfLags, double kpssStatistic, double kpssCriticalValue) {
        this.adfStationary = adfStationary;
        this.kpssStationary = kpssStationary;
        this.adfStatistic = adfStatistic;
        this.adfCriticalValue = adfCriticalValue;
        this.adfLags = adfLags;
        this.kpssStatistic = kpssStatistic;
        this.kpssCriticalValue = kpssCriticalValue;
    }

    static StationarityResult inconclusive() {
        return new StationarityResult(false, false, Double.NaN, Double.NaN, 0, Double.NaN, Double.NaN);
    }

    public boolean isAdfStationary() { return adfStationary; }
    public boolean isKpssStationary() { return kpssStationary; }

    public boolean isStationary() {
        return adfStationary && kpssStationary;
    }

    public double getAdfStatistic() { return adfStatistic; }
    public double getAdfCriticalValue() { return adfCriticalValue; }
    public int getAdfLags() { return adfLags; }
    public double getKpssStatistic() { return kpssStatistic; }
    public double getKpssCriticalValue() { return kpssCriticalValue; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("is_stationary", isStationary());
        out.put("adf_stationary", adfStationary);
        out.put("kpss_stationary", kpssStationary);
        out.put("adf_statistic", adfStatistic);
        out.put("adf_critical_value", adfCriticalValue);
        out.put("adf_lags", adfLags);
        out.put("kpss_statistic", kpssStatistic);
        out.put("kpss_critical_value", kpssCriticalValue);
        return out;
    }

    @Override
    public String toString() {
        return String.format("StationarityResult{adf=%.4f (crit %.4f, lags=%d), kpss=%.4f (crit %.3f), stationary=%s}",
                adfStatistic, adfCriticalValue, adfLags, kpssStatistic, kpssCriticalValue, isStationary());
    }
}

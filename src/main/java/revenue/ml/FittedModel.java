package revenue.ml;

import revenue.data.TimeSeries;

import java.util.Objects;

/**
 * A SARIMA model estimated on a dated revenue series.
 * <p>
 * Immutable and owned by whoever called the fit; a refit produces a new instance. Forecasts
 * continue from the last date of {@link #getSeries()}.
 */
public final class FittedModel {

    private final TimeSeries series;
    private final Estimation estimation;

    FittedModel(TimeSeries series, Estimation estimation) {
        this.series = Objects.requireNonNull(series, "series");
        this.estimation = Objects.requireNonNull(estimation, "estimation");
    }

    public TimeSeries getSeries() { return series; }
    public Estimation getEstimation() { return estimation; }

    public ModelOrder getOrder() { return estimation.getOrder(); }
    public SeasonalOrder getSeasonalOrder() { return estimation.getSeasonalOrder(); }
    public double[] getParameters() { return estimation.getParameters(); }
    public double getSigma2() { return estimation.getSigma2(); }
    public double getLogLikelihood() { return estimation.getLogLikelihood(); }
    public double getAic() { return estimation.getAic(); }
    public double getBic() { return estimation.getBic(); }
    public double[] getResiduals() { return estimation.getResiduals(); }
    public int getEffectiveObservations() { return estimation.getEffectiveObservations(); }

    public Sarima getModel() {
        return estimation.toSarima();
    }

    @Override
    public String toString() {
        return String.format("SARIMA%s%s AIC=%.2f on %s", getOrder(), getSeasonalOrder(), getAic(), series);
    }
}

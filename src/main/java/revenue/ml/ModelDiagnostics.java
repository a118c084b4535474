package revenue.ml;

import java.util.LinkedHashMap;
import java.util.Map;

/** Fit-quality statistics of a {@link FittedModel}. */
public final class ModelDiagnostics {

    private final double aic;
    private final double bic;
    private final double logLikelihood;
    private final double residualMean;
    private final double residualStd;
    private final double ljungBoxPValue;
    private final ModelOrder order;
    private final SeasonalOrder seasonalOrder;

    ModelDiagnostics(double aic, double bic, double logLikelihood, double residualMean, double residualStd,
                     double ljungBoxPValue, ModelOrder order, SeasonalOrder seasonalOrder) {
        this.aic = aic;
        this.bic = bic;
        this.logLikelihood = logLikelihood;
        this.residualMean = residualMean;
        this.residualStd = residualStd;
        this.ljungBoxPValue = ljungBoxPValue;
        this.order = order;
        this.seasonalOrder = seasonalOrder;
    }

    public double getAic() { return aic; }
    public double getBic() { return bic; }
    public double getLogLikelihood() { return logLikelihood; }
    public double getResidualMean() { return residualMean; }
    public double getResidualStd() { return residualStd; }

    /** Low values (below 0.05) point at autocorrelation left in the residuals. NaN for constant residuals. */
    public double getLjungBoxPValue() { return ljungBoxPValue; }

    public ModelOrder getOrder() { return order; }
    public SeasonalOrder getSeasonalOrder() { return seasonalOrder; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("aic", aic);
        out.put("bic", bic);
        out.put("log_likelihood", logLikelihood);
        out.put("residual_mean", residualMean);
        out.put("residual_std", residualStd);
        out.put("ljung_box_p_value", ljungBoxPValue);
        out.put("order", order.toList());
        out.put("seasonal_order", seasonalOrder.toList());
        return out;
    }
}

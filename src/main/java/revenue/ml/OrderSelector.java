package revenue.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.exception.ModelFitException;

/**
 * Grid search over non-seasonal ARIMA orders by AIC.
 * <p>
 * Every (p, d, q) in [0, maxP] x [0, maxD] x [0, maxQ] is estimated without a seasonal part, in
 * ascending p, then d, then q. A candidate replaces the best so far only with a strictly lower AIC,
 * so the first one enumerated wins ties. Candidates that fail to fit are skipped.
 * <p>
 * Every candidate's likelihood is conditioned on the first {@code maxD} observations, so all of
 * them are scored on the same later observations whatever their differencing order.
 */
public class OrderSelector {

    private static final Logger LOG = LoggerFactory.getLogger(OrderSelector.class);

    public static final int DEFAULT_MAX_P = 3;
    public static final int DEFAULT_MAX_D = 2;
    public static final int DEFAULT_MAX_Q = 3;

    /** Returned when no candidate converges. */
    public static final ModelOrder FALLBACK_ORDER = ModelOrder.of(1, 1, 1);

    private final SarimaEstimator estimator;

    public OrderSelector(SarimaEstimator estimator) {
        this.estimator = estimator;
    }

    public ModelOrder select(double[] series) {
        return select(series, DEFAULT_MAX_P, DEFAULT_MAX_D, DEFAULT_MAX_Q);
    }

    public ModelOrder select(double[] series, int maxP, int maxD, int maxQ) {
        if (maxP < 0 || maxD < 0 || maxQ < 0) throw new IllegalArgumentException("Search bounds must be non-negative");
        ModelOrder best = FALLBACK_ORDER;
        double bestAic = Double.POSITIVE_INFINITY;
        int failed = 0;
        for (int p = 0; p <= maxP; p++) {
            for (int d = 0; d <= maxD; d++) {
                for (int q = 0; q <= maxQ; q++) {
                    ModelOrder candidate = ModelOrder.of(p, d, q);
                    try {
                        double aic = estimator.estimate(series, candidate, SeasonalOrder.none(), maxD).getAic();
                        if (aic < bestAic) {
                            bestAic = aic;
                            best = candidate;
                        }
                    } catch (ModelFitException e) {
                        failed++;
                        LOG.debug("Skipping ARIMA{}: {}", candidate, e.getMessage());
                    }
                }
            }
        }
        if (Double.isInfinite(bestAic)) {
            LOG.warn("No ARIMA candidate converged, using {}", FALLBACK_ORDER);
        } else {
            LOG.info("Auto-selected ARIMA order: {} (AIC: {}, {} candidates skipped)",
                    best, String.format("%.2f", bestAic), failed);
        }
        return best;
    }
}

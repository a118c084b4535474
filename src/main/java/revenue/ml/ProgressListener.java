package revenue.ml;

/**
 * Receives the pipeline stage names as {@link RevenueForecaster} moves through them.
 */
@FunctionalInterface
public interface ProgressListener {

    String PREPARING = "preparing data";
    String FITTING = "fitting model";
    String FORECASTING = "forecasting";
    String BACKTESTING = "backtesting";

    ProgressListener NONE = stage -> { };

    void onStage(String stage);
}

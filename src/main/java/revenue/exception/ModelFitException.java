package revenue.exception;

/** The optimizer failed to converge or the sample was too small to estimate a model. */
public class ModelFitException extends ForecastingException {
    public ModelFitException(String message) {
        super("MODEL_FIT_ERROR", message);
    }
    public ModelFitException(String message, Throwable cause) {
        super("MODEL_FIT_ERROR", message, cause);
    }
}

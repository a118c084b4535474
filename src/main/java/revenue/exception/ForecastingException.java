package revenue.exception;

/**
 * Base type of every failure the forecasting engine reports to its callers.
 * Each subclass carries a stable error code so that callers can tell
 * "no data" from "model could not converge" from "not yet fit".
 */
public abstract class ForecastingException extends RuntimeException {

    private final String errorCode;

    protected ForecastingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ForecastingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

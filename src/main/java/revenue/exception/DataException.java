package revenue.exception;

/** Empty, malformed or insufficient input series. */
public class DataException extends ForecastingException {
    public DataException(String message) {
        super("DATA_ERROR", message);
    }
    public DataException(String message, Throwable cause) {
        super("DATA_ERROR", message, cause);
    }
}

package revenue.exception;

public class ForecastException extends ForecastingException {
    public ForecastException(String message) {
        super("FORECAST_ERROR", message);
    }
}

package revenue.exception;

public class BacktestException extends ForecastingException {
    public BacktestException(String message) {
        super("BACKTEST_ERROR", message);
    }
    public BacktestException(String message, Throwable cause) {
        super("BACKTEST_ERROR", message, cause);
    }
}

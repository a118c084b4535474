package revenue.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ForecastingExceptionTest {

    @Test
    void eachFailureKindHasItsOwnCode() {
        assertThat(new DataException("x").getErrorCode()).isEqualTo("DATA_ERROR");
        assertThat(new ModelFitException("x").getErrorCode()).isEqualTo("MODEL_FIT_ERROR");
        assertThat(new ForecastException("x").getErrorCode()).isEqualTo("FORECAST_ERROR");
        assertThat(new BacktestException("x").getErrorCode()).isEqualTo("BACKTEST_ERROR");
    }

    @Test
    void causeIsKept() {
        ModelFitException cause = new ModelFitException("did not converge");

        BacktestException wrapped = new BacktestException("Failed to fit model for backtesting", cause);

        assertThat(wrapped).hasCause(cause).isInstanceOf(ForecastingException.class);
    }
}

package revenue;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import revenue.exception.BacktestException;
import revenue.exception.DataException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ForecastApiTest {

    private static final Gson GSON = new Gson();

    private final ForecastApi api = new ForecastApi(ForecastSettings.defaults());

    private String body(Object... keyValues) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("data", api.sample().subList(0, 120));
        for (int i = 0; i < keyValues.length; i += 2) request.put((String) keyValues[i], keyValues[i + 1]);
        return GSON.toJson(request);
    }

    @Test
    void sampleIsAYearOfDailyRows() {
        List<Map<String, Object>> sample = api.sample();

        assertThat(sample).hasSize(366);
        assertThat(sample.get(0)).containsEntry("date", "2024-01-01");
        assertThat(sample).isEqualTo(api.sample());
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecastReturnsRowsAndDiagnostics() {
        Map<String, Object> response = api.forecast(body("forecastDays", 10));

        List<Map<String, Object>> rows = (List<Map<String, Object>>) response.get("forecast");
        assertThat(rows).hasSize(10);
        assertThat(rows.get(0)).containsEntry("date", "2024-04-30");
        assertThat(response).containsKeys("summary", "validation", "stationarity", "diagnostics");
    }

    @Test
    @SuppressWarnings("unchecked")
    void requestKeysOverrideSettings() {
        Map<String, Object> response = api.forecast(body("forecastDays", 3, "sarimaOrder", List.of(0, 1, 1),
            "seasonalOrder", List.of(0, 1, 1, 7)));

        Map<String, Object> diagnostics = (Map<String, Object>) response.get("diagnostics");
        assertThat(diagnostics).containsEntry("order", List.of(0, 1, 1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void backtestScoresTheLastDays() {
        Map<String, Object> response = api.backtest(body("testDays", 30));

        assertThat(response).containsEntry("test_start", "2024-03-31").containsEntry("test_end", "2024-04-29");
        assertThat((Map<String, Object>) response.get("metrics")).containsKeys("mae", "rmse", "mape");
    }

    @Test
    void backtestWithoutEnoughHistoryFails() {
        assertThatThrownBy(() -> api.backtest(body("testDays", 100)))
            .isInstanceOf(BacktestException.class);
    }

    @Test
    void stationarityReportsBothTests() {
        assertThat(api.stationarity(body())).containsKeys("adf_stationary", "kpss_stationary");
    }

    @Test
    @SuppressWarnings("unchecked")
    void decomposeUsesTheSeasonalPeriod() {
        Map<String, Object> response = api.decompose(body());

        List<Map<String, Object>> components = (List<Map<String, Object>>) response.get("components");
        assertThat(response).containsEntry("period", 7);
        assertThat(components).hasSize(120);
        assertThat(components.get(0)).containsKeys("date", "observed", "trend", "seasonal", "residual");
        assertThat((Double) components.get(0).get("trend")).isNaN();
        assertThat((Double) components.get(60).get("trend")).isBetween(100.0, 250.0);
    }

    @Test
    void rejectsBadRequests() {
        assertThatThrownBy(() -> api.forecast(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> api.forecast("{not json"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> api.forecast("{\"forecastDays\": 5}"))
            .isInstanceOf(DataException.class);
        assertThatThrownBy(() -> api.forecast("{\"data\": [{\"date\": \"2024-01-01\", \"sales\": 1}]}"))
            .isInstanceOf(DataException.class);
        assertThatThrownBy(() -> api.forecast("{\"data\": [{\"date\": {}, \"revenue\": 1}]}"))
            .isInstanceOf(DataException.class);
        assertThatThrownBy(() -> api.forecast(body("forecastDays", 0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> api.forecast(body("forecastDays", 2.5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

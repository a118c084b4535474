package revenue;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import revenue.data.Observation;
import revenue.data.RevenueSeriesReader;
import revenue.data.SeriesPreparer;
import revenue.data.TimeSeries;
import revenue.exception.DataException;
import revenue.ml.BacktestResult;
import revenue.ml.ForecastReport;
import revenue.ml.OrderValidation;
import revenue.ml.RevenueForecaster;
import revenue.ml.SeasonalDecomposer;
import revenue.ml.SeasonalOrder;
import revenue.ml.StationarityAnalyzer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * JSON request handling behind the web routes, kept apart from Javalin so it can be called directly.
 * <p>
 * Request bodies are objects with a {@code data} array of {@code {date, revenue}} rows. Any other
 * settings key in the body (for example {@code sarimaOrder} or {@code confidenceInterval})
 * overrides the server settings for that request only.
 */
public class ForecastApi {

    static final String DATA_FIELD = "data";
    static final String FORECAST_DAYS_FIELD = "forecastDays";
    static final String BACKTEST_DAYS_FIELD = "backtestDays";
    static final String TEST_DAYS_FIELD = "testDays";

    /** Longest horizon the API accepts, two years of days. */
    static final int MAX_FORECAST_DAYS = 730;

    private final ForecastSettings settings;

    public ForecastApi(ForecastSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** POST /api/forecast: prepare, fit, forecast and (if {@code backtestDays} > 0) backtest. */
    public Map<String, Object> forecast(String body) {
        JsonObject request = parse(body);
        List<Observation> rows = rows(request);
        ForecastSettings effective = settingsFor(request);
        int forecastDays = intField(request, FORECAST_DAYS_FIELD, effective.getDefaultForecastDays());
        if (forecastDays < 1 || forecastDays > MAX_FORECAST_DAYS) {
            throw new IllegalArgumentException("forecastDays must be between 1 and " + MAX_FORECAST_DAYS + ": " + forecastDays);
        }
        int backtestDays = intField(request, BACKTEST_DAYS_FIELD, 0);
        ForecastReport report = new RevenueForecaster(effective).run(rows, forecastDays, backtestDays, null);
        return report.toMap();
    }

    /** POST /api/backtest: holdout backtest over the last {@code testDays} days. */
    public Map<String, Object> backtest(String body) {
        JsonObject request = parse(body);
        List<Observation> rows = rows(request);
        ForecastSettings effective = settingsFor(request);
        int testDays = intField(request, TEST_DAYS_FIELD, effective.getDefaultBacktestDays());
        if (testDays < 1) throw new IllegalArgumentException("testDays must be positive: " + testDays);
        BacktestResult result = new RevenueForecaster(effective).backtest(rows, testDays);
        return result.toMap();
    }

    /** POST /api/stationarity: ADF and KPSS on the prepared series. */
    public Map<String, Object> stationarity(String body) {
        JsonObject request = parse(body);
        ForecastSettings effective = settingsFor(request);
        TimeSeries series = new SeriesPreparer(effective.getOutlierMultiplier(), effective.getOutlierPercentile())
                .prepare(rows(request)).getSeries();
        return new StationarityAnalyzer().analyze(series.values()).toMap();
    }

    /** POST /api/decompose: additive trend, seasonal and residual parts of the prepared series. */
    public Map<String, Object> decompose(String body) {
        JsonObject request = parse(body);
        ForecastSettings effective = settingsFor(request);
        TimeSeries series = new SeriesPreparer(effective.getOutlierMultiplier(), effective.getOutlierPercentile())
                .prepare(rows(request)).getSeries();
        SeasonalOrder seasonal = OrderValidation.toSeasonalOrder(effective.getSeasonalOrder());
        int period = seasonal != null && !seasonal.isNone() ? seasonal.getPeriod() : SeasonalOrder.DEFAULT_PERIOD;
        SeasonalDecomposer.Decomposition parts = new SeasonalDecomposer(period).decompose(series);

        List<Map<String, Object>> rows = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", series.date(i).toString());
            row.put("observed", parts.getObserved()[i]);
            row.put("trend", parts.getTrend()[i]);
            row.put("seasonal", parts.getSeasonal()[i]);
            row.put("residual", parts.getResidual()[i]);
            rows.add(row);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("period", period);
        out.put("components", rows);
        return out;
    }

    /** GET /api/sample */
    public List<Map<String, Object>> sample() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Observation o : sampleObservations()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", o.getDate().toString());
            row.put("revenue", o.getRevenue());
            out.add(row);
        }
        return out;
    }

    /**
     * A year of synthetic daily revenue: slow upward trend, weekend peaks and seeded noise.
     * Same output on every call.
     */
    public static List<Observation> sampleObservations() {
        Random random = new Random(42);
        LocalDate start = LocalDate.of(2024, 1, 1);
        List<Observation> rows = new ArrayList<>(366);
        for (int t = 0; t < 366; t++) {
            LocalDate date = start.plusDays(t);
            double weekly = 25 * Math.sin(2 * Math.PI * t / 7.0);
            double revenue = 150 + 0.1 * t + weekly + 8 * random.nextGaussian();
            rows.add(Observation.of(date, Math.round(Math.max(0, revenue) * 100) / 100.0));
        }
        return rows;
    }

    private ForecastSettings settingsFor(JsonObject request) {
        JsonObject overrides = request.deepCopy();
        overrides.remove(DATA_FIELD);
        overrides.remove(FORECAST_DAYS_FIELD);
        overrides.remove(BACKTEST_DAYS_FIELD);
        overrides.remove(TEST_DAYS_FIELD);
        return overrides.size() == 0 ? settings : settings.withOverrides(overrides);
    }

    private static JsonObject parse(String body) {
        if (body == null || body.isBlank()) throw new IllegalArgumentException("Missing request body");
        JsonElement root;
        try {
            root = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON", e);
        }
        if (!root.isJsonObject()) throw new IllegalArgumentException("Request body must be a JSON object");
        return root.getAsJsonObject();
    }

    private static List<Observation> rows(JsonObject request) {
        JsonElement data = request.get(DATA_FIELD);
        if (data == null || !data.isJsonArray()) throw new DataException("Missing or invalid 'data' array");
        if (data.getAsJsonArray().isEmpty()) throw new DataException("Empty 'data' array");
        return RevenueSeriesReader.fromJson(data.getAsJsonArray());
    }

    private static int intField(JsonObject request, String name, int fallback) {
        JsonElement el = request.get(name);
        if (el == null || el.isJsonNull()) return fallback;
        try {
            double d = el.getAsDouble();
            if (d != Math.rint(d)) throw new IllegalArgumentException(name + " must be a whole number: " + d);
            return (int) d;
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new IllegalArgumentException(name + " must be a number", e);
        }
    }
}

package revenue;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Forecast settings: defaults from the classpath resource {@code forecast-settings.json}, overridden
 * key by key by the JSON file named in {@code REVENUE_FORECAST_CONFIG}, if set.
 * <p>
 * Orders are kept as loosely typed lists, the way they arrive from JSON; they are validated only
 * when a model is fit, and invalid ones trigger the automatic order search.
 */
public final class ForecastSettings {

    public static final String DEFAULTS_RESOURCE = "/forecast-settings.json";
    public static final String CONFIG_ENV = "REVENUE_FORECAST_CONFIG";

    private static final Gson GSON = new Gson();

    private int defaultForecastDays;
    private int defaultBacktestDays;
    private List<Object> sarimaOrder;
    private List<Object> seasonalOrder;
    private double confidenceInterval;
    private double outlierMultiplier;
    private double outlierPercentile;
    private int maxConsecutiveZeroDays;
    private int minObservations;
    private int maxIterations;
    private int maxP;
    private int maxD;
    private int maxQ;

    /** Defaults plus the optional user file from the environment. */
    public static ForecastSettings load() throws IOException {
        String env = System.getenv(CONFIG_ENV);
        Path user = env != null && !env.isBlank() ? Paths.get(env.trim()) : null;
        return load(user);
    }

    public static ForecastSettings load(Path userFile) throws IOException {
        JsonObject merged = defaultsJson();
        if (userFile != null) {
            try (Reader reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                merge(merged, parseObject(reader, userFile.toString()));
            }
        }
        return toSettings(merged);
    }

    /** Built-in defaults only. */
    public static ForecastSettings defaults() {
        return toSettings(defaultsJson());
    }

    /** Defaults with the given JSON object's keys applied on top. */
    public static ForecastSettings fromJson(String overrides) {
        JsonObject merged = defaultsJson();
        merge(merged, parseObject(new StringReader(overrides), "overrides"));
        return toSettings(merged);
    }

    /** A copy of these settings with the given keys replaced; unknown keys are ignored. */
    public ForecastSettings withOverrides(JsonObject overrides) {
        JsonObject merged = GSON.toJsonTree(this).getAsJsonObject();
        merge(merged, overrides);
        return toSettings(merged);
    }

    private static ForecastSettings toSettings(JsonObject json) {
        try {
            return GSON.fromJson(json, ForecastSettings.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid settings: " + e.getMessage(), e);
        }
    }

    private static JsonObject defaultsJson() {
        try (InputStream in = ForecastSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing " + DEFAULTS_RESOURCE + " on classpath");
            return parseObject(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load " + DEFAULTS_RESOURCE, e);
        }
    }

    private static JsonObject parseObject(Reader reader, String source) {
        try {
            JsonElement el = JsonParser.parseReader(reader);
            if (!el.isJsonObject()) throw new IllegalArgumentException(source + " must contain a JSON object");
            return el.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON in " + source, e);
        }
    }

    /** Nested objects merge recursively; any other user value replaces the default. */
    private static void merge(JsonObject target, JsonObject user) {
        for (Map.Entry<String, JsonElement> entry : user.entrySet()) {
            JsonElement existing = target.get(entry.getKey());
            if (existing != null && existing.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(existing.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                target.add(entry.getKey(), entry.getValue());
            }
        }
    }

    public int getDefaultForecastDays() { return defaultForecastDays; }
    public int getDefaultBacktestDays() { return defaultBacktestDays; }
    public List<Object> getSarimaOrder() { return sarimaOrder == null ? null : new ArrayList<>(sarimaOrder); }
    public List<Object> getSeasonalOrder() { return seasonalOrder == null ? null : new ArrayList<>(seasonalOrder); }
    public double getConfidenceInterval() { return confidenceInterval; }
    public double getOutlierMultiplier() { return outlierMultiplier; }
    public double getOutlierPercentile() { return outlierPercentile; }
    public int getMaxConsecutiveZeroDays() { return maxConsecutiveZeroDays; }
    public int getMinObservations() { return minObservations; }
    public int getMaxIterations() { return maxIterations; }
    public int getMaxP() { return maxP; }
    public int getMaxD() { return maxD; }
    public int getMaxQ() { return maxQ; }
}

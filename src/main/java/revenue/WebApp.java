package revenue;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.exception.BacktestException;
import revenue.exception.DataException;
import revenue.exception.ForecastException;
import revenue.exception.ForecastingException;
import revenue.exception.ModelFitException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Revenue forecasting over HTTP.
 * Run with: mvn exec:java
 * Then POST {"data": [{"date": "2024-01-01", "revenue": 120.5}, ...]} to http://localhost:7000/api/forecast
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);

    static final int DEFAULT_PORT = 7000;

    // NaN shows up in diagnostics (e.g. Ljung-Box on constant residuals)
    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    static int getPort(String env) {
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid PORT '{}', using {}", env, DEFAULT_PORT);
            }
        }
        return DEFAULT_PORT;
    }

    public static void main(String[] args) throws IOException {
        int port = getPort(System.getenv("PORT"));
        ForecastSettings settings = ForecastSettings.load();
        create(new ForecastApi(settings)).start("0.0.0.0", port);
        LOG.info("Revenue forecast API: http://localhost:{}", port);
    }

    /** Routes and error mapping, without starting the server. */
    static Javalin create(ForecastApi api) {
        Javalin app = Javalin.create();

        app.post("/api/forecast", ctx -> sendJson(ctx, 200, api.forecast(ctx.body())));
        app.post("/api/backtest", ctx -> sendJson(ctx, 200, api.backtest(ctx.body())));
        app.post("/api/stationarity", ctx -> sendJson(ctx, 200, api.stationarity(ctx.body())));
        app.post("/api/decompose", ctx -> sendJson(ctx, 200, api.decompose(ctx.body())));
        app.get("/api/sample", ctx -> sendJson(ctx, 200, api.sample()));
        app.get("/api/health", ctx -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("status", "ok");
            sendJson(ctx, 200, h);
        });

        app.exception(DataException.class, (e, ctx) -> sendError(ctx, 400, e));
        app.exception(ModelFitException.class, (e, ctx) -> sendError(ctx, 422, e));
        app.exception(BacktestException.class, (e, ctx) -> sendError(ctx, 422, e));
        app.exception(ForecastException.class, (e, ctx) -> sendError(ctx, 409, e));
        app.exception(IllegalArgumentException.class, (e, ctx) ->
                sendJson(ctx, 400, errorBody("INVALID_REQUEST", e.getMessage())));
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {}", ctx.path(), e);
            sendJson(ctx, 500, errorBody("INTERNAL_ERROR", e.getClass().getSimpleName()));
        });
        return app;
    }

    private static void sendError(Context ctx, int status, ForecastingException e) {
        LOG.warn("{} {}: {}", ctx.method(), ctx.path(), e.getMessage());
        sendJson(ctx, status, errorBody(e.getErrorCode(), e.getMessage()));
    }

    static Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", code);
        out.put("message", message != null ? message : "");
        return out;
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}

package forecast;

import forecast.api.ForecastRequest;
import forecast.api.ForecastService;
import forecast.api.Json;
import forecast.api.ServerSettings;
import forecast.data.InvalidInputException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP front end for the forecasting service.
 * Run with: mvn exec:java
 * Then POST a series to http://localhost:7000/api/forecast
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    public static void main(String[] args) {
        ServerSettings settings = ServerSettings.fromEnvironment();
        ForecastService service = new ForecastService(settings);
        Javalin app = create(service).start("0.0.0.0", settings.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            service.close();
        }));
        log.info("Forecast service listening on http://localhost:{}", settings.getPort());
    }

    public static Javalin create(ForecastService service) {
        Javalin app = Javalin.create();

        app.post("/api/forecast", ctx ->
                sendJson(ctx, 200, service.forecast(ForecastRequest.fromJson(ctx.body()))));

        app.post("/api/compare-models", ctx ->
                sendJson(ctx, 200, service.compareModels(ForecastRequest.fromJson(ctx.body()))));

        app.get("/api/health", ctx -> sendJson(ctx, 200, service.health()));

        app.get("/api/models", ctx -> sendJson(ctx, 200, service.models()));

        app.exception(InvalidInputException.class, (e, ctx) -> {
            log.warn("Rejected request to {}: {}", ctx.path(), e.getMessage());
            sendJson(ctx, 400, error(e));
        });
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Request to {} failed", ctx.path(), e);
            sendJson(ctx, 500, error(e));
        });
        return app;
    }

    private static Map<String, Object> error(Exception e) {
        Map<String, Object> out = new LinkedHashMap<>();
        String msg = e.getMessage();
        out.put("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        return out;
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(Json.GSON.toJson(body));
    }
}

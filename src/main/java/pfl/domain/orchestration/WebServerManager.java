package pfl.domain.orchestration;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.ServerConfig;
import pfl.domain.api.AlertController;
import pfl.domain.api.ErrorResponse;
import pfl.domain.api.EventRelayController;
import pfl.domain.api.PrinterController;

import java.lang.reflect.Type;

import static io.javalin.apibuilder.ApiBuilder.get;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @author Martin Sustik <sustik@herman.cz>
 * @since 19/11/2025
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final PrinterController printerController;
    private final EventRelayController eventRelayController;
    private final AlertController alertController;
    private final Gson gson;

    private Javalin javalinApp;

    public WebServerManager(
            ServerConfig serverConfig,
            PrinterController printerController,
            EventRelayController eventRelayController,
            AlertController alertController) {
        this.serverConfig = serverConfig;
        this.printerController = printerController;
        this.eventRelayController = eventRelayController;
        this.alertController = alertController;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp();
        logger.info("✓ Web server started successfully");
    }

    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    private Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());

            config.bundledPlugins.enableCors(cors -> {
                cors.addRule(corsRule -> {
                    corsRule.anyHost();
                    corsRule.allowCredentials = false;
                });
            });

            config.router.apiBuilder(() -> {
                get("/", ctx -> ctx.redirect("/api/health"));

                printerController.registerRoutes();
                eventRelayController.registerRoutes();
                alertController.registerRoutes();
            });
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception on {} {}", ctx.method(), ctx.path(), exception);
            ctx.status(500).json(new ErrorResponse("Internal server error", exception.getMessage()));
        });

        return app.start(serverConfig.host(), serverConfig.port());
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}

package agents.concierge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static agents.concierge.Driver.logLevel;

/**
 * Master HTTP router for the concierge system.
 * Owns the single HTTP server and mounts the sub-routers of the tool-call server,
 * the specialist services and the dispatcher host under their base paths.
 */
public class MCPRouterService extends AbstractVerticle {

    private final int configuredPort;
    // Mounts requested before start, applied in registration order
    private final List<Consumer<Router>> pendingMounts = new ArrayList<>();

    private Router mainRouter;
    private HttpServer httpServer;

    /**
     * @param port HTTP port to listen on; 0 picks an ephemeral port
     */
    public MCPRouterService(int port) {
        this.configuredPort = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);

        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("status", "healthy")
                .put("timestamp", System.currentTimeMillis())
                .encode()));

        mountPending();

        HttpServerOptions options = new HttpServerOptions()
            .setPort(configuredPort)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);
        httpServer
            .requestHandler(mainRouter)
            .listen()
            .onSuccess(server -> {
                vertx.eventBus().publish("log", "MCPRouterService started on port " + server.actualPort() + ",2,MCPRouterService,Service,System");
                vertx.eventBus().publish("mcp.router.ready", new JsonObject()
                    .put("port", server.actualPort())
                    .put("address", "localhost")
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            })
            .onFailure(err -> {
                vertx.eventBus().publish("log", "Failed to start MCPRouterService: " + err.getMessage() + ",0,MCPRouterService,Service,System");
                startPromise.fail(err);
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("accept");
        allowedHeaders.add("mcp-session-id");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .exposedHeader("Mcp-Session-Id")
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create()
            .setBodyLimit(10 * 1024 * 1024));

        // Anything that escapes a sub-router handler becomes a JSON 500
        mainRouter.route().failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
            vertx.eventBus().publish("log", "Unhandled failure on " + ctx.request().path() + ": "
                + (failure != null ? failure.getMessage() : "status " + statusCode) + ",0,MCPRouterService,HTTP,Failure");
            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("detail", failure != null ? String.valueOf(failure.getMessage()) : "Request failed")
                    .encode());
        });
    }

    /**
     * Mount a sub-router under a base path, e.g. <code>/a2a/support</code>.
     * Routers registered before this service has started are mounted on start.
     */
    public synchronized void registerRouter(String path, Router subRouter) {
        apply(main -> {
            main.route(path + "/*").subRouter(subRouter);
            if (logLevel >= 2) {
                vertx.eventBus().publish("log", "Mounted router at path: " + path + ",2,MCPRouterService,Service,System");
            }
        });
    }

    /**
     * Bind a handler to one exact path of the main router. Used for endpoints that live
     * on a base path itself, such as <code>POST /mcp</code>. Register these before the
     * sub-router of the same base path.
     */
    public synchronized void registerEndpoint(HttpMethod method, String path, Handler<RoutingContext> handler) {
        apply(main -> {
            main.route(method, path).handler(handler);
            if (logLevel >= 3) {
                vertx.eventBus().publish("log", "Bound " + method + " " + path + ",3,MCPRouterService,Service,System");
            }
        });
    }

    /**
     * Port the HTTP server is bound to, or -1 before it has started.
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : -1;
    }

    private void apply(Consumer<Router> mount) {
        if (mainRouter != null) {
            mount.accept(mainRouter);
        } else {
            pendingMounts.add(mount);
        }
    }

    private synchronized void mountPending() {
        for (Consumer<Router> mount : pendingMounts) {
            mount.accept(mainRouter);
        }
        pendingMounts.clear();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (httpServer != null) {
            httpServer.close()
                .onSuccess(v -> {
                    vertx.eventBus().publish("log", "MCPRouterService stopped,2,MCPRouterService,Service,System");
                    stopPromise.complete();
                })
                .onFailure(stopPromise::fail);
        } else {
            stopPromise.complete();
        }
    }
}

package agents.concierge;

import agents.concierge.a2a.AgentType;
import agents.concierge.agents.CustomerDataAgent;
import agents.concierge.agents.SpecialistAgent;
import agents.concierge.agents.SupportAgent;
import agents.concierge.apis.AgentServiceVerticle;
import agents.concierge.config.ConciergeConfig;
import agents.concierge.hosts.RouterAgent;
import agents.concierge.hosts.RouterHost;
import agents.concierge.hosts.base.intelligence.IntentAnalyzer;
import agents.concierge.mcp.clients.CustomerServiceClient;
import agents.concierge.mcp.servers.CustomerServiceServer;
import agents.concierge.services.Logger;
import agents.concierge.services.MCPRouterService;
import agents.concierge.store.CustomerStore;
import agents.concierge.transport.AgentTransport;
import agents.concierge.transport.AgentTransports;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx;

  private static final String DATA_PATH = "./data";

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private final ConciergeConfig config;

  private Driver(ConciergeConfig config) {
    this.config = config;
  }

  /**
   * Publishes a log line, or keeps the newest EMERGENCY_BUFFER_SIZE lines until the Logger is up.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish("log", message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(4)
        .setEventLoopPoolSize(1));

    captureOrPublishLog("=== Customer Service Agent System Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    // Deploy Logger FIRST before anything else
    System.out.println("Deploying Logger as first component...");
    vertx.deployVerticle(new Logger(DATA_PATH), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        loadEnvironmentAndStart();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.err.println("Cannot continue without logging capability");
        System.exit(1);
      }
    });

    Runtime.getRuntime().addShutdownHook(new Thread(() ->
        vertx.eventBus().publish("saveAllDataToFiles_OnTermination", new JsonObject())));
  }

  private static void loadEnvironmentAndStart() {
    Dotenv.configure()
        .filename(".env.local")
        .systemProperties()  // accessible via System.getProperty()
        .ignoreIfMissing()
        .load();
    captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");

    ConciergeConfig config;
    try {
      config = ConciergeConfig.fromEnvironment();
    } catch (IllegalArgumentException e) {
      captureOrPublishLog("Invalid configuration: " + e.getMessage() + ",0,Driver,StartUp,Config");
      System.err.println("FATAL: invalid configuration: " + e.getMessage());
      vertx.close().onComplete(v -> System.exit(1));
      return;
    }
    if (logLevel >= 2) captureOrPublishLog("Configuration: " + config.toJson().encode().replace(',', ';') + ",2,Driver,StartUp,Config");

    new Driver(config).doIt();
  }

  private void doIt() {
    if (logLevel >= 1) captureOrPublishLog("Driver initialization starting,1,Driver,StartUp,System");

    CustomerStore store = new CustomerStore(config.getDbPath());
    MCPRouterService routerService = new MCPRouterService(config.getHttpPort());

    initStore(store)
        .compose(v -> vertx.deployVerticle(routerService))
        .compose(id -> vertx.deployVerticle(new CustomerServiceServer(store, "/mcp", routerService)))
        .compose(id -> deployAgents(routerService))
        .onSuccess(v -> {
          captureOrPublishLog("=== Customer Service Agent System Started ===,1,Driver,System,System");
          vertx.eventBus().publish("system.fully.ready", new JsonObject()
              .put("port", routerService.actualPort())
              .put("transport", config.isUseHttpTransport() ? "http" : "direct")
              .put("timestamp", System.currentTimeMillis()));
        })
        .onFailure(err -> {
          captureOrPublishLog("Startup failed: " + err.getMessage() + ",0,Driver,StartUp,System");
          System.err.println("Fatal error - startup failed: " + err.getMessage());
        });
  }

  private Future<Void> initStore(CustomerStore store) {
    return vertx.executeBlocking(() -> {
      store.init();
      if (config.isSeedDatabase()) {
        store.resetAndSeed();
        captureOrPublishLog("Database seeded at " + config.getDbPath() + ",1,Driver,StartUp,Database");
      }
      return null;
    }, false);
  }

  private Future<Void> deployAgents(MCPRouterService routerService) {
    CustomerServiceClient dataClient = new CustomerServiceClient(vertx, config.getMcpServerUrl(), config.getTimeoutMs());
    CustomerServiceClient supportClient = new CustomerServiceClient(vertx, config.getMcpServerUrl(), config.getTimeoutMs());

    SpecialistAgent dataAgent = new CustomerDataAgent(vertx, dataClient);
    SpecialistAgent supportAgent = new SupportAgent(vertx, supportClient, config.getPremiumCustomerId());

    return initializeClient(dataClient, AgentType.CUSTOMER_DATA)
        .compose(v -> initializeClient(supportClient, AgentType.SUPPORT))
        .compose(v -> vertx.deployVerticle(new AgentServiceVerticle(dataAgent, "/a2a/customer-data", routerService)))
        .compose(id -> vertx.deployVerticle(new AgentServiceVerticle(supportAgent, "/a2a/support", routerService)))
        .compose(id -> {
          AgentTransport transport = AgentTransports.create(vertx, config, List.of(dataAgent, supportAgent));
          RouterAgent routerAgent = new RouterAgent(vertx, transport, new IntentAnalyzer(), config.getMaxIterations());
          return vertx.deployVerticle(new RouterHost(routerAgent, routerService));
        })
        .mapEmpty();
  }

  // Not fatal: without the handshake the first tool call obtains the session instead
  private Future<Void> initializeClient(CustomerServiceClient client, AgentType owner) {
    return client.initialize()
        .<Void>mapEmpty()
        .recover(err -> {
          captureOrPublishLog("MCP client of " + owner.getValue() + " failed to initialize: " + err.getMessage()
              + ",1,Driver,StartUp,MCP");
          return Future.succeededFuture();
        });
  }
}

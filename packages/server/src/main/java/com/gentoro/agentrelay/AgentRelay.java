package com.gentoro.agentrelay;

import com.gentoro.agentrelay.actuator.ActuatorService;
import com.gentoro.agentrelay.agent.Agent;
import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.agent.AgentRuntime;
import com.gentoro.agentrelay.agent.AgentServer;
import com.gentoro.agentrelay.agent.LocalAgent;
import com.gentoro.agentrelay.agent.RemoteAgent;
import com.gentoro.agentrelay.backend.BackendFactory;
import com.gentoro.agentrelay.backend.OperationBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.broker.ToolBinding;
import com.gentoro.agentrelay.broker.ToolBroker;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.descriptor.AgentSkill;
import com.gentoro.agentrelay.descriptor.DescriptorReference;
import com.gentoro.agentrelay.descriptor.DescriptorResolver;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.exception.StateException;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.http.OkHttpFactory;
import com.gentoro.agentrelay.mcp.McpServer;
import com.gentoro.agentrelay.orchestrator.HostAgentHandler;
import com.gentoro.agentrelay.orchestrator.OrchestrationResult;
import com.gentoro.agentrelay.orchestrator.OrchestratorService;
import com.gentoro.agentrelay.orchestrator.progress.LoggingProgressSink;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.prompt.PromptRepositoryFactory;
import com.gentoro.agentrelay.proxy.RemoteAgentProxy;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import com.gentoro.agentrelay.reasoning.ReasoningUnitFactory;
import com.gentoro.agentrelay.router.Router;
import com.gentoro.agentrelay.router.RouterFactory;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.tree.ImmutableNode;

/**
 * Application context. {@link #initialize()} builds, in order: configuration and logging levels,
 * prompt repository, operation backend and catalog, tool broker (bindings validated against the
 * catalog), reasoning unit, hosted agents, agent registry, router and front door; then registers
 * every HTTP endpoint on the shared Jetty server and starts it.
 */
public class AgentRelay {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(AgentRelay.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private PromptRepository promptRepository;
  private OperationBackend backend;
  private ToolBroker broker;
  private ReasoningUnit reasoningUnit;
  private final Map<String, HostedAgent> hostedAgents = new LinkedHashMap<>();
  private AgentRegistry registry;
  private OrchestratorService orchestrator;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private ExecutorService runExecutor;
  private ExecutorService fanOutExecutor;
  private ExecutorService localAgentExecutor;
  private OrchestrationResult lastResult;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  /** An agent served by this process, with the path it is hosted under. */
  public record HostedAgent(AgentRuntime runtime, String role, String path) {}

  public AgentRelay(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    Configuration cfg = configuration();
    com.gentoro.agentrelay.logging.LoggingService.applyConfiguration(cfg);

    this.promptRepository = PromptRepositoryFactory.create(cfg);
    this.backend = BackendFactory.create(cfg);
    OperationCatalog catalog = OperationCatalog.of(backend);
    this.broker =
        new ToolBroker(
            catalog,
            backend,
            Duration.ofMillis(cfg.getLong("orchestrator.retry.backoff-ms", 200L)));
    this.reasoningUnit = ReasoningUnitFactory.create(cfg);

    this.runExecutor = Executors.newCachedThreadPool(threadFactory("agentrelay-run"));
    this.fanOutExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, cfg.getInt("orchestrator.parallel.threads", 8)),
            threadFactory("agentrelay-fanout"));
    this.localAgentExecutor = Executors.newCachedThreadPool(threadFactory("agentrelay-agent"));

    createHostedAgents(cfg);
    broker.validateBindings(
        hostedAgents.values().stream().map(h -> h.runtime().binding()).toList());

    this.registry = createRegistry(cfg);
    Router router =
        RouterFactory.create(cfg, registry, promptRepository, reasoningUnit, fanOutExecutor);
    this.orchestrator =
        new OrchestratorService(
            registry,
            router,
            Duration.ofMillis(cfg.getLong("orchestrator.run-deadline-ms", 120_000L)),
            runExecutor);

    this.httpServer = new EmbeddedJettyServer(cfg);
    httpServer.prepare();
    try {
      new ActuatorService(httpServer, catalog, this::registry).register();
      AgentServer agentServer = new AgentServer(httpServer);
      hostedAgents.values().forEach(h -> agentServer.register(h.path(), h.runtime()));
      agentServer.register(hostPath(cfg), new HostAgentHandler(hostDescriptor(cfg), orchestrator));
      if (cfg.getBoolean("mcp.enabled", false)) {
        this.mcpServer = new McpServer(cfg, httpServer, broker, orchestrator);
        mcpServer.register();
      }
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.asAgentRelayException(
          e, ex -> new ExecutionException("Could not start http server", ex));
    }

    switch (startupParameters.mode()) {
      case "server" -> log.info(
          "AgentRelay ready on {} ({} hosted agents, {} routed agents)",
          httpServer.baseUrl(),
          hostedAgents.size(),
          registry.size());
      case "query" -> {
        this.lastResult =
            orchestrator.handleQuery(
                startupParameters.getParameter("query", String.class),
                new LoggingProgressSink(log, 0L, 1L));
        System.out.println(JacksonUtility.toJson(lastResult));
        shutdown();
      }
      default -> {
        shutdown();
        throw new ConfigException("Invalid mode: " + startupParameters.mode());
      }
    }
  }

  private void createHostedAgents(Configuration cfg) {
    int maxToolRounds = cfg.getInt("reasoning.max-tool-rounds", 6);
    for (HierarchicalConfiguration<ImmutableNode> section :
        ConfigurationProvider.sections(cfg, "agents")) {
      String id = required(section, "id", "agents");
      String role = required(section, "role", "agents[" + id + "]");
      String path = section.getString("path", id);
      AgentDescriptor descriptor =
          AgentDescriptor.builder()
              .agentId(id)
              .endpoint(AgentServer.endpointPath(path))
              .displayName(section.getString("display-name", id))
              .description(section.getString("description", null))
              .version(section.getString("version", "1.0"))
              .streaming(section.getBoolean("streaming", false))
              .skills(skills(section))
              .build();
      AgentRuntime runtime =
          new AgentRuntime(
              descriptor,
              section.getString("instruction", ""),
              ToolBinding.of(id, ConfigurationProvider.strings(section, "allowed-operations")),
              broker,
              reasoningUnit,
              maxToolRounds);
      if (hostedAgents.put(id, new HostedAgent(runtime, role, path)) != null) {
        throw new ConfigException("Duplicate hosted agent id: " + id);
      }
    }
    log.info("Created {} hosted agents", hostedAgents.size());
  }

  private static List<AgentSkill> skills(HierarchicalConfiguration<ImmutableNode> agent) {
    List<AgentSkill> skills = new ArrayList<>();
    for (HierarchicalConfiguration<ImmutableNode> s :
        ConfigurationProvider.sections(agent, "skills")) {
      skills.add(
          new AgentSkill(
              s.getString("id"),
              s.getString("name", null),
              s.getString("description", null),
              ConfigurationProvider.strings(s, "tags"),
              ConfigurationProvider.strings(s, "examples")));
    }
    return skills;
  }

  /**
   * Each remote is one of:
   *
   * <pre>
   * - { id: customer_data, role: data, url: http://host:8080/agents/customer_data }
   * - { id: customer_data, role: data, local: customer_data }
   * - { id: billing, role: billing, endpoint: http://host:9000/invoke, streaming: true }
   * </pre>
   */
  private AgentRegistry createRegistry(Configuration cfg) {
    OkHttpClient httpClient = OkHttpFactory.create(cfg);
    DescriptorResolver resolver = new DescriptorResolver(httpClient);
    RemoteAgentProxy proxy =
        new RemoteAgentProxy(
            httpClient,
            cfg.getInt("orchestrator.retry.max-retries", 1),
            Duration.ofMillis(cfg.getLong("orchestrator.retry.backoff-ms", 200L)));
    long defaultTimeoutMs = cfg.getLong("orchestrator.agent-timeout-ms", 30_000L);

    AgentRegistry.Builder builder = AgentRegistry.builder();
    for (HierarchicalConfiguration<ImmutableNode> section :
        ConfigurationProvider.sections(cfg, "orchestrator.remotes")) {
      String id = required(section, "id", "orchestrator.remotes");
      String role = required(section, "role", "orchestrator.remotes[" + id + "]");
      Duration timeout = Duration.ofMillis(section.getLong("timeout-ms", defaultTimeoutMs));

      Agent agent;
      if (section.containsKey("local")) {
        HostedAgent hosted = hostedAgents.get(section.getString("local"));
        if (hosted == null) {
          throw new ConfigException(
              "Remote '%s' refers to unknown hosted agent '%s'"
                  .formatted(id, section.getString("local")));
        }
        agent = new LocalAgent(hosted.runtime(), localAgentExecutor);
      } else if (section.containsKey("url")) {
        agent =
            new RemoteAgent(
                id, DescriptorReference.discovery(section.getString("url")), resolver, proxy);
      } else if (section.containsKey("endpoint")) {
        AgentDescriptor inline =
            AgentDescriptor.builder()
                .agentId(id)
                .endpoint(section.getString("endpoint"))
                .displayName(section.getString("display-name", id))
                .description(section.getString("description", null))
                .streaming(section.getBoolean("streaming", false))
                .skills(skills(section))
                .build();
        agent = new RemoteAgent(id, DescriptorReference.inline(inline), resolver, proxy);
      } else {
        throw new ConfigException(
            "Remote '%s' needs one of 'url', 'endpoint' or 'local'".formatted(id));
      }
      builder.register(id, role, agent, timeout);
    }
    AgentRegistry built = builder.build();
    log.info("Registry: {}", built.agentIds());
    return built;
  }

  private static String hostPath(Configuration cfg) {
    return cfg.getString("orchestrator.host.path", "host");
  }

  private static AgentDescriptor hostDescriptor(Configuration cfg) {
    return AgentDescriptor.builder()
        .agentId(cfg.getString("orchestrator.host.id", "host"))
        .endpoint(AgentServer.endpointPath(hostPath(cfg)))
        .displayName(cfg.getString("orchestrator.host.display-name", "AgentRelay"))
        .description("Routes requests across the registered agents and returns one answer.")
        .build();
  }

  private static String required(Configuration section, String key, String where) {
    String value = section.getString(key, null);
    if (value == null || value.isBlank()) {
      throw ConfigException.missing(key, where);
    }
    return value.trim();
  }

  private static ThreadFactory threadFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "agentrelay-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        closeQuietly(backend);
        for (ExecutorService executor :
            new ExecutorService[] {runExecutor, fanOutExecutor, localAgentExecutor}) {
          if (executor != null) {
            executor.shutdownNow();
          }
        }
        awaitTermination(runExecutor);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private static void awaitTermination(ExecutorService executor) {
    if (executor == null) return;
    try {
      if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("Some runs were still active at shutdown");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while releasing {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AgentRelay not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public PromptRepository promptRepository() {
    return promptRepository;
  }

  public ToolBroker broker() {
    return broker;
  }

  public Map<String, HostedAgent> hostedAgents() {
    return hostedAgents;
  }

  public AgentRegistry registry() {
    return registry;
  }

  public OrchestratorService orchestrator() {
    return orchestrator;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  /** Result of the one-shot run in {@code query} mode. */
  public OrchestrationResult lastResult() {
    return lastResult;
  }
}

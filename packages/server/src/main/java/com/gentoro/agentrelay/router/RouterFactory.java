package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the router selected by {@code orchestrator.mode}.
 *
 * <pre>
 * orchestrator:
 *   mode: dynamic
 *   sequential:
 *     order: [customer_data, support_specialist]
 *   dynamic:
 *     budget: 2
 *     decision-maker: keyword     # or reasoning
 *   parallel:
 *     synthesizer: template       # or reasoning
 *     grace-ms: 1000
 * </pre>
 */
public final class RouterFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(RouterFactory.class);

  private RouterFactory() {}

  public static Router create(
      Configuration configuration,
      AgentRegistry registry,
      PromptRepository prompts,
      ReasoningUnit reasoningUnit,
      ExecutorService fanOutExecutor) {
    RoutingMode mode =
        RoutingMode.parse(configuration.getString("orchestrator.mode", "sequential"));
    log.info("Routing mode: {} over {} agents", mode, registry.size());

    return switch (mode) {
      case SEQUENTIAL -> {
        List<String> order =
            configuration.getList(String.class, "orchestrator.sequential.order", List.of());
        SequentialRouter router = new SequentialRouter(order);
        router.validate(registry);
        yield router;
      }
      case DYNAMIC -> {
        int budget =
            configuration.getInt("orchestrator.dynamic.budget", Math.max(1, registry.size()));
        if (budget < 0) {
          throw new ConfigException("orchestrator.dynamic.budget must not be negative");
        }
        String maker =
            configuration
                .getString("orchestrator.dynamic.decision-maker", "keyword")
                .trim()
                .toLowerCase(Locale.ROOT);
        RoutingDecisionMaker decisionMaker =
            switch (maker) {
              case "keyword" -> new KeywordRoutingDecisionMaker();
              case "reasoning" -> new ReasoningRoutingDecisionMaker(prompts, reasoningUnit);
              default -> throw new ConfigException(
                  "Unknown orchestrator.dynamic.decision-maker: " + maker);
            };
        yield new DynamicRouter(decisionMaker, budget);
      }
      case PARALLEL -> {
        String name =
            configuration
                .getString("orchestrator.parallel.synthesizer", "template")
                .trim()
                .toLowerCase(Locale.ROOT);
        Synthesizer synthesizer =
            switch (name) {
              case "template" -> new TemplateSynthesizer(prompts);
              case "reasoning" -> new ReasoningSynthesizer(prompts, reasoningUnit);
              default -> throw new ConfigException(
                  "Unknown orchestrator.parallel.synthesizer: " + name);
            };
        Duration grace =
            Duration.ofMillis(configuration.getLong("orchestrator.parallel.grace-ms", 1000L));
        yield new ParallelRouter(fanOutExecutor, synthesizer, grace);
      }
    };
  }
}

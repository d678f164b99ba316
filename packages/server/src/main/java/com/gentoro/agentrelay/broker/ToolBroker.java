package com.gentoro.agentrelay.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.backend.OperationBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.backend.ParameterSpec;
import com.gentoro.agentrelay.exception.BackendException;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.UnauthorizedException;
import com.gentoro.agentrelay.exception.ValidationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mediates every access of an agent to the operation backend.
 *
 * <p>Checks run in a fixed order: authorization against the agent's {@link ToolBinding}, then
 * argument validation against the operation's parameters, then the backend call. The first two
 * never touch the backend. Backend failures surface as {@link BackendException}; non-mutating
 * operations get one retry, mutating operations are executed at most once.
 */
public class ToolBroker {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ToolBroker.class);

  private final OperationCatalog catalog;
  private final OperationBackend backend;
  private final Retry readRetry;

  public ToolBroker(OperationCatalog catalog, OperationBackend backend, Duration retryBackoff) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.readRetry =
        Retry.of(
            "broker-read",
            RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(Math.max(1L, retryBackoff.toMillis())))
                .retryExceptions(BackendException.class)
                .build());
    this.readRetry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "Retrying read operation after backend failure: {}",
                    e.getLastThrowable() == null ? "" : e.getLastThrowable().getMessage()));
  }

  public OperationCatalog catalog() {
    return catalog;
  }

  /**
   * Fail fast when any binding names an operation the catalog does not offer. Called once at
   * startup, after the catalog was fetched.
   */
  public void validateBindings(Collection<ToolBinding> bindings) {
    List<String> problems = new ArrayList<>();
    for (ToolBinding binding : bindings) {
      for (String operation : binding.allowedOperations()) {
        if (!catalog.contains(operation)) {
          problems.add("%s -> %s".formatted(binding.agentId(), operation));
        }
      }
    }
    if (!problems.isEmpty()) {
      throw new ConfigException(
          "Tool bindings reference operations missing from the backend catalog: " + problems);
    }
    log.info("Validated {} tool bindings against {} operations", bindings.size(), catalog.size());
  }

  /** Operation definitions visible to the given binding, in catalog order. */
  public List<OperationDefinition> operationsFor(ToolBinding binding) {
    return catalog.all().stream().filter(d -> binding.allows(d.name())).toList();
  }

  public JsonNode invoke(ToolBinding binding, String operation, Map<String, Object> args) {
    if (binding == null || !binding.allows(operation)) {
      throw new UnauthorizedException(binding == null ? null : binding.agentId(), operation);
    }

    OperationDefinition definition =
        catalog
            .find(operation)
            .orElseThrow(
                () ->
                    new ValidationException(
                        "Operation '%s' is not part of the backend catalog".formatted(operation),
                        Map.of("operation", operation)));

    Map<String, Object> arguments = args == null ? Map.of() : args;
    validate(definition, arguments);

    if (definition.mutates()) {
      log.debug("[{}] invoking mutating operation {} once", binding.agentId(), operation);
      return call(operation, arguments);
    }
    log.debug("[{}] invoking read operation {}", binding.agentId(), operation);
    return readRetry.executeSupplier(() -> call(operation, arguments));
  }

  private JsonNode call(String operation, Map<String, Object> args) {
    try {
      return backend.execute(operation, args);
    } catch (RuntimeException e) {
      if (e instanceof BackendException be) {
        throw be;
      }
      throw new BackendException(operation, ExceptionUtil.describe(e), e);
    }
  }

  private static void validate(OperationDefinition definition, Map<String, Object> args) {
    Map<String, String> violations = new LinkedHashMap<>();
    for (ParameterSpec spec : definition.parameters()) {
      Object value = args.get(spec.name());
      if (value == null) {
        if (spec.required()) {
          violations.put(spec.name(), "required");
        }
      } else if (!spec.type().accepts(value)) {
        violations.put(
            spec.name(),
            "expected %s but got %s"
                .formatted(spec.type().schemaName(), value.getClass().getSimpleName()));
      }
    }
    for (String name : args.keySet()) {
      if (definition.parameter(name).isEmpty()) {
        violations.put(name, "unknown parameter");
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(
          "Invalid arguments for '%s': %s".formatted(definition.name(), violations),
          Map.of("operation", definition.name(), "violations", violations));
    }
  }
}

package com.gentoro.agentrelay.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * The external system that actually performs operations. Implementations report failures by
 * throwing; the broker wraps whatever they throw.
 */
public interface OperationBackend extends AutoCloseable {

  /** The catalog of operations this backend offers. */
  List<OperationDefinition> listOperations();

  /** Execute one operation with already validated arguments. */
  JsonNode execute(String operation, Map<String, Object> args);

  @Override
  default void close() {}
}

package com.gentoro.agentrelay.backend;

import com.gentoro.agentrelay.exception.ConfigException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Immutable, name-indexed view of the operations a backend exposes. */
public class OperationCatalog {
  private final Map<String, OperationDefinition> operations;

  public OperationCatalog(Collection<OperationDefinition> definitions) {
    Map<String, OperationDefinition> byName = new LinkedHashMap<>();
    for (OperationDefinition definition : definitions) {
      if (byName.putIfAbsent(definition.name(), definition) != null) {
        throw new ConfigException(
            "Operation '%s' is declared more than once by the backend".formatted(definition.name()));
      }
    }
    this.operations = Collections.unmodifiableMap(byName);
  }

  public static OperationCatalog of(OperationBackend backend) {
    return new OperationCatalog(backend.listOperations());
  }

  public Optional<OperationDefinition> find(String name) {
    return Optional.ofNullable(operations.get(name));
  }

  public boolean contains(String name) {
    return operations.containsKey(name);
  }

  public Set<String> names() {
    return operations.keySet();
  }

  public List<OperationDefinition> all() {
    return List.copyOf(operations.values());
  }

  public int size() {
    return operations.size();
  }
}

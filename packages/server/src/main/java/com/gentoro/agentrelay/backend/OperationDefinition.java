package com.gentoro.agentrelay.backend;

import com.gentoro.agentrelay.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contract of one backend operation.
 *
 * @param name unique within the backend
 * @param description short description, shown to reasoning units and MCP clients
 * @param parameters declared parameters, in declaration order
 * @param returns name of the result type
 * @param mutates true for destructive or administrative operations; these are never retried
 */
public record OperationDefinition(
    String name,
    String description,
    List<ParameterSpec> parameters,
    String returns,
    boolean mutates) {

  public OperationDefinition {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Operation name must not be blank");
    }
    description = description == null ? "" : description;
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    returns = returns == null || returns.isBlank() ? "object" : returns;
  }

  public Optional<ParameterSpec> parameter(String parameterName) {
    return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
  }

  public static Builder builder(String name) {
    return new Builder().name(name);
  }

  public static final class Builder {
    private String name;
    private String description;
    private final List<ParameterSpec> parameters = new ArrayList<>();
    private String returns;
    private boolean mutates;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(String parameter, ParameterSpec.Type type, String description) {
      this.parameters.add(ParameterSpec.required(parameter, type, description));
      return this;
    }

    public Builder optional(String parameter, ParameterSpec.Type type, String description) {
      this.parameters.add(ParameterSpec.optional(parameter, type, description));
      return this;
    }

    public Builder parameter(ParameterSpec spec) {
      this.parameters.add(spec);
      return this;
    }

    public Builder returns(String returns) {
      this.returns = returns;
      return this;
    }

    public Builder mutates(boolean mutates) {
      this.mutates = mutates;
      return this;
    }

    public OperationDefinition build() {
      return new OperationDefinition(name, description, parameters, returns, mutates);
    }
  }
}

package com.gentoro.agentrelay.descriptor;

import com.gentoro.agentrelay.exception.ValidationException;
import java.util.List;

/**
 * Capability descriptor of an agent, as published at the well-known discovery path.
 *
 * <p>{@code agentId} and {@code endpoint} are mandatory; everything else is informational. Once
 * resolved, a descriptor is immutable.
 */
public record AgentDescriptor(
    String agentId,
    String endpoint,
    String displayName,
    String description,
    String version,
    boolean streaming,
    List<AgentSkill> skills) {

  public AgentDescriptor {
    if (agentId == null || agentId.isBlank()) {
      throw new ValidationException("Descriptor is missing 'agentId'");
    }
    if (endpoint == null || endpoint.isBlank()) {
      throw new ValidationException("Descriptor '%s' is missing 'endpoint'".formatted(agentId));
    }
    skills = skills == null ? List.of() : List.copyOf(skills);
    if (displayName == null || displayName.isBlank()) {
      displayName = agentId;
    }
  }

  public AgentDescriptor withEndpoint(String newEndpoint) {
    return new AgentDescriptor(
        agentId, newEndpoint, displayName, description, version, streaming, skills);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String agentId;
    private String endpoint;
    private String displayName;
    private String description;
    private String version = "1.0";
    private boolean streaming;
    private List<AgentSkill> skills = List.of();

    public Builder agentId(String agentId) {
      this.agentId = agentId;
      return this;
    }

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder streaming(boolean streaming) {
      this.streaming = streaming;
      return this;
    }

    public Builder skills(List<AgentSkill> skills) {
      this.skills = skills;
      return this;
    }

    public AgentDescriptor build() {
      return new AgentDescriptor(
          agentId, endpoint, displayName, description, version, streaming, skills);
    }
  }
}

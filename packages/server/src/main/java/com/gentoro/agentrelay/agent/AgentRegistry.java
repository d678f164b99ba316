package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.NotFoundException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Agents a router may call, in registry order. Every agent has a unique id, a unique role (the key
 * under which its output lands in the scratch space) and its own call timeout.
 */
public class AgentRegistry {

  public record Entry(String agentId, String role, Agent agent, Duration timeout) {
    public Entry {
      Objects.requireNonNull(agentId, "agentId");
      Objects.requireNonNull(role, "role");
      Objects.requireNonNull(agent, "agent");
      Objects.requireNonNull(timeout, "timeout");
    }
  }

  private final List<Entry> entries;

  private AgentRegistry(List<Entry> entries) {
    this.entries = Collections.unmodifiableList(entries);
  }

  public List<Entry> entries() {
    return entries;
  }

  public List<String> agentIds() {
    return entries.stream().map(Entry::agentId).toList();
  }

  public Optional<Entry> find(String agentId) {
    return entries.stream().filter(e -> e.agentId().equals(agentId)).findFirst();
  }

  public Entry get(String agentId) {
    return find(agentId)
        .orElseThrow(() -> new NotFoundException("Unknown agent: " + agentId));
  }

  public boolean contains(String agentId) {
    return find(agentId).isPresent();
  }

  public int size() {
    return entries.size();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final List<Entry> entries = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private final Set<String> roles = new HashSet<>();

    public Builder register(String agentId, String role, Agent agent, Duration timeout) {
      if (!ids.add(agentId)) {
        throw new ConfigException("Duplicate agent id in registry: " + agentId);
      }
      if (!roles.add(role)) {
        throw new ConfigException("Duplicate agent role in registry: " + role);
      }
      entries.add(new Entry(agentId, role, agent, timeout));
      return this;
    }

    public AgentRegistry build() {
      return new AgentRegistry(new ArrayList<>(entries));
    }
  }
}

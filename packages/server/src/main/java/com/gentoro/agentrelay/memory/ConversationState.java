package com.gentoro.agentrelay.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.protocol.Turn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-scoped conversation: the ordered turns and the scratch space where each agent's output is
 * stored under its role key (last write wins). Created for one query and discarded afterwards.
 * Safe for concurrent writers.
 */
public class ConversationState {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ConversationState.class);

  private final List<Turn> turns = Collections.synchronizedList(new ArrayList<>());
  private final Map<String, JsonNode> scratch = Collections.synchronizedMap(new LinkedHashMap<>());

  public static ConversationState startingWith(String query) {
    ConversationState state = new ConversationState();
    state.addTurn(Turn.of(Turn.USER, query));
    return state;
  }

  public void addTurn(Turn turn) {
    turns.add(turn);
    log.trace("ConversationState: turn {} ({} chars)", turn.role(), turn.content().length());
  }

  public List<Turn> turns() {
    synchronized (turns) {
      return List.copyOf(turns);
    }
  }

  public void putScratch(String key, JsonNode value) {
    scratch.put(key, value);
    log.trace("ConversationState: put scratch {}", key);
  }

  public JsonNode scratch(String key) {
    return scratch.get(key);
  }

  /** Point-in-time copy, in write order. */
  public Map<String, JsonNode> scratchSnapshot() {
    synchronized (scratch) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(scratch));
    }
  }
}

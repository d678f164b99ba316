package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.memory.ConversationState;
import com.gentoro.agentrelay.orchestrator.progress.NoOpProgressSink;
import com.gentoro.agentrelay.orchestrator.progress.ProgressSink;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** State of one orchestration run, shared between the front door and the router. */
public class RunContext {
  /** Stage spanning the whole run; one step is reported per finished agent. */
  public static final String RUN_STAGE = "run";

  private final String query;
  private final ConversationState state;
  private final ProgressSink progress;
  private final List<StageOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
  private volatile RoutingDecision decision;

  public RunContext(String query, ProgressSink progress) {
    this.query = Objects.requireNonNull(query, "query");
    this.state = ConversationState.startingWith(query);
    this.progress = progress == null ? NoOpProgressSink.INSTANCE : progress;
  }

  public static RunContext of(String query) {
    return new RunContext(query, null);
  }

  public String query() {
    return query;
  }

  public ConversationState state() {
    return state;
  }

  public ProgressSink progress() {
    return progress;
  }

  public void record(StageOutcome outcome) {
    outcomes.add(outcome);
  }

  public List<StageOutcome> outcomes() {
    synchronized (outcomes) {
      return List.copyOf(outcomes);
    }
  }

  /** The routing decision of a dynamic run, null for other modes. */
  public RoutingDecision decision() {
    return decision;
  }

  public void decision(RoutingDecision decision) {
    this.decision = decision;
  }
}

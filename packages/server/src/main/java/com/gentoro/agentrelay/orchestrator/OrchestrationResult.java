package com.gentoro.agentrelay.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.exception.ErrorDetails;
import com.gentoro.agentrelay.router.RoutingDecision;
import com.gentoro.agentrelay.router.StageOutcome;
import java.util.List;
import java.util.Map;

/**
 * What the front door returns for one query: either an answer, or a structured failure naming the
 * agents involved. Stage outcomes, failed ones included, are always listed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestrationResult(
    Status status,
    String query,
    String answer,
    Map<String, JsonNode> scratch,
    List<StageOutcome> stages,
    RoutingDecision decision,
    ErrorDetails error,
    List<String> implicatedAgents,
    long elapsedMs) {

  public enum Status {
    SUCCESS,
    FAILED
  }

  public OrchestrationResult {
    scratch = scratch == null ? Map.of() : scratch;
    stages = stages == null ? List.of() : List.copyOf(stages);
    implicatedAgents = implicatedAgents == null ? List.of() : List.copyOf(implicatedAgents);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public List<StageOutcome> failedStages() {
    return stages.stream().filter(s -> s.status() == StageOutcome.Status.FAILED).toList();
  }
}

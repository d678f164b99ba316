package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.reasoning.ReasoningRequest;
import com.gentoro.agentrelay.reasoning.ReasoningStep;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hands the rendered {@code synthesis} template to a reasoning unit as its instruction and returns
 * the unit's answer. No operations are offered to the unit.
 */
public class ReasoningSynthesizer implements Synthesizer {
  private final PromptRepository prompts;
  private final ReasoningUnit reasoningUnit;

  public ReasoningSynthesizer(PromptRepository prompts, ReasoningUnit reasoningUnit) {
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.reasoningUnit = Objects.requireNonNull(reasoningUnit, "reasoningUnit");
  }

  @Override
  public String synthesize(String query, List<SynthesisInput> inputs) {
    String instruction = TemplateSynthesizer.fullSession(prompts, query, inputs).renderText();
    ReasoningStep step =
        reasoningUnit.next(ReasoningRequest.direct("synthesizer", instruction, query));
    if (!step.isFinal()) {
      throw new ExecutionException(
          "Synthesis requested operation '%s' instead of answering".formatted(step.operation()),
          Map.of("operation", step.operation()));
    }
    return step.answer();
  }
}

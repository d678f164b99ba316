package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.prompt.PromptTemplate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Renders the {@code synthesis} template into a deterministic combined answer. */
public class TemplateSynthesizer implements Synthesizer {
  static final String TEMPLATE = "synthesis";

  private final PromptRepository prompts;

  public TemplateSynthesizer(PromptRepository prompts) {
    this.prompts = Objects.requireNonNull(prompts, "prompts");
  }

  @Override
  public String synthesize(String query, List<SynthesisInput> inputs) {
    return prompts
        .get(TEMPLATE)
        .newSession()
        .enableOnly("combined-answer", variables(query, inputs))
        .renderText();
  }

  static Map<String, Object> variables(String query, List<SynthesisInput> inputs) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("query", query);
    vars.put(
        "results",
        inputs.stream()
            .map(
                i ->
                    Map.<String, Object>of(
                        "agentId", i.agentId(),
                        "role", i.role(),
                        "available", i.available(),
                        "text", i.text()))
            .toList());
    return vars;
  }

  /** Template session with both the instructions and the combined answer enabled. */
  static PromptTemplate.Session fullSession(
      PromptRepository prompts, String query, List<SynthesisInput> inputs) {
    return prompts
        .get(TEMPLATE)
        .newSession()
        .enable("instructions", Map.of())
        .enable("combined-answer", variables(query, inputs));
  }
}

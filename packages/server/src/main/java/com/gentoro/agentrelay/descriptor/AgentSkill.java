package com.gentoro.agentrelay.descriptor;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A capability an agent advertises in its descriptor.
 *
 * @param skillId stable identifier of the skill
 * @param name short human-readable name, optional
 * @param description what the skill does
 * @param tags free-form keywords, optional
 * @param examples sample requests the skill handles
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AgentSkill(
    String skillId, String name, String description, List<String> tags, List<String> examples) {

  public AgentSkill {
    tags = tags == null ? List.of() : List.copyOf(tags);
    examples = examples == null ? List.of() : List.copyOf(examples);
  }
}

package com.gentoro.agentrelay.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.exception.PromptException;
import com.gentoro.agentrelay.prompt.PromptTemplate;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the YAML layout shared by all prompt repositories:
 *
 * <pre>
 * sections:
 *   - role: system | user | assistant
 *     id: section-id
 *     enabled: true
 *     content: |
 *       Pebble template text
 * </pre>
 */
final class PromptYamlParser {
  private PromptYamlParser() {}

  static PromptTemplate parse(String id, String yamlContent) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(yamlContent);
    } catch (IOException e) {
      throw new PromptException("Prompt is not valid YAML: " + id, e);
    }
    JsonNode arr = root == null ? null : root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new PromptException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.Section> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String roleStr = n.path("role").asText(null);
      if (roleStr == null) {
        throw new PromptException("Missing role for a section in prompt: " + id);
      }
      PromptTemplate.Role role =
          switch (roleStr.toLowerCase(Locale.ROOT)) {
            case "user" -> PromptTemplate.Role.USER;
            case "assistant" -> PromptTemplate.Role.ASSISTANT;
            case "system" -> PromptTemplate.Role.SYSTEM;
            default -> throw new PromptException(
                "Unknown role '" + roleStr + "' in prompt: " + id);
          };

      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new PromptException("Missing section id in prompt: " + id);
      }

      boolean enabled = n.path("enabled").asBoolean(false);
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new PromptException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }

      sections.add(new PromptTemplate.Section(sectionId, role, enabled, content));
    }
    return new PebblePromptTemplate(id, sections);
  }
}

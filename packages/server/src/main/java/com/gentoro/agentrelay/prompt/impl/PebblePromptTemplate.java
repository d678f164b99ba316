package com.gentoro.agentrelay.prompt.impl;

import com.gentoro.agentrelay.exception.PromptException;
import com.gentoro.agentrelay.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PromptTemplate} whose sections are compiled once with Pebble. Variables are strict, so a
 * missing variable fails the render; output is plain text, so nothing is escaped.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder()
          .strictVariables(true)
          .autoEscaping(false)
          .newLineTrimming(false)
          .build();

  private final String id;
  private final List<Section> sections;
  private final Map<String, PebbleTemplate> compiled = new LinkedHashMap<>();

  public PebblePromptTemplate(String id, List<Section> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    for (Section section : this.sections) {
      if (compiled.put(section.id(), ENGINE.getLiteralTemplate(section.content())) != null) {
        throw new PromptException(
            "Duplicate section '%s' in prompt '%s'".formatted(section.id(), id));
      }
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<Section> sections() {
    return sections;
  }

  @Override
  public Session newSession() {
    return new PebbleSession();
  }

  private String render(String sectionId, Map<String, Object> vars) {
    StringWriter out = new StringWriter();
    try {
      compiled.get(sectionId).evaluate(out, vars);
    } catch (IOException | RuntimeException e) {
      throw new PromptException(
          "Failed to render section '%s' of prompt '%s'".formatted(sectionId, id), e);
    }
    return out.toString().strip();
  }

  private class PebbleSession implements Session {
    private final Map<String, Map<String, Object>> enabled = new HashMap<>();

    PebbleSession() {
      resetToDefaults();
    }

    @Override
    public Session enable(String sectionId, Map<String, Object> vars) {
      if (!compiled.containsKey(sectionId)) {
        throw new PromptException("Prompt '%s' has no section '%s'".formatted(id, sectionId));
      }
      enabled.put(sectionId, vars == null ? new HashMap<>() : new HashMap<>(vars));
      return this;
    }

    @Override
    public Session enableOnly(String sectionId, Map<String, Object> vars) {
      enabled.clear();
      return enable(sectionId, vars);
    }

    @Override
    public Session disable(String... sectionIds) {
      for (String sectionId : sectionIds) {
        enabled.remove(sectionId);
      }
      return this;
    }

    @Override
    public Session resetToDefaults() {
      enabled.clear();
      sections.stream()
          .filter(Section::enabledByDefault)
          .forEach(s -> enabled.put(s.id(), new HashMap<>()));
      return this;
    }

    @Override
    public Map<String, String> render() {
      Map<String, String> out = new LinkedHashMap<>();
      for (Section section : sections) {
        Map<String, Object> vars = enabled.get(section.id());
        if (vars != null) {
          out.put(section.id(), PebblePromptTemplate.this.render(section.id(), vars));
        }
      }
      return out;
    }
  }
}

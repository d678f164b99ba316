package com.gentoro.agentrelay.prompt;

import java.util.List;
import java.util.Map;

/**
 * A prompt made of named sections, each one a Pebble template. A {@link Session} chooses the
 * sections to render and their variables; the template itself is immutable and shared.
 */
public interface PromptTemplate {
  /** Template name, e.g. {@code "synthesis"}. */
  String id();

  /** Sections in file order. */
  List<Section> sections();

  Session newSession();

  /** Who a section is addressed as when the text is handed to a reasoning unit. */
  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Section(String id, Role role, boolean enabledByDefault, String content) {}

  /**
   * Mutable selection of sections. A new session starts with the sections marked {@code enabled}
   * in the file, without variables.
   */
  interface Session {
    Session enable(String sectionId, Map<String, Object> vars);

    /** Disable every other section, then enable this one. */
    Session enableOnly(String sectionId, Map<String, Object> vars);

    Session disable(String... sectionIds);

    Session resetToDefaults();

    /**
     * Render the enabled sections in file order.
     *
     * @return rendered text by section id
     * @throws com.gentoro.agentrelay.exception.PromptException when a section fails to render,
     *     e.g. on a missing variable
     */
    Map<String, String> render();

    /** The enabled sections joined by a blank line. */
    default String renderText() {
      return String.join("\n\n", render().values());
    }
  }
}

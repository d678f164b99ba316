package com.gentoro.agentrelay.utility;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class StringUtility {

  /** Lower-case, trimmed form used for keyword matching. */
  public static String normalize(String input) {
    return input == null ? "" : input.trim().toLowerCase(Locale.ROOT);
  }

  public static String truncate(String input, int limit) {
    if (input == null) return "";
    if (limit < 0 || input.length() <= limit) return input;
    return input.substring(0, limit) + " ...";
  }

  /**
   * Extract a fenced snippet (e.g. {@code ```json ... ```}) from free text. Returns null when no
   * fenced block of the given type is present.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)(?:```%s\\s*)(.+?)(?:\\s*```)".formatted(type);
    Pattern pattern = Pattern.compile(regex);
    Matcher matcher = pattern.matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }
}

package com.gentoro.agentrelay.reasoning;

import com.gentoro.agentrelay.utility.StringUtility;
import java.util.Arrays;
import java.util.List;

/**
 * Coarse classification of a query by keywords: does it need customer data, support handling, is
 * it urgent.
 */
public record QueryIntent(boolean needsData, boolean needsSupport, boolean urgent) {
  public static final List<String> DATA_KEYWORDS =
      List.of("customer", "ticket", "id", "list", "search", "account");
  public static final List<String> SUPPORT_KEYWORDS =
      List.of("help", "issue", "problem", "reset", "fix");
  public static final List<String> URGENCY_KEYWORDS =
      List.of("urgent", "immediately", "asap", "critical");

  public enum ExecutionMode {
    SEQUENTIAL,
    DATA_ONLY,
    SUPPORT_ONLY,
    NONE
  }

  public static QueryIntent analyze(String query) {
    List<String> tokens = tokens(query);
    return new QueryIntent(
        matchesAny(tokens, DATA_KEYWORDS),
        matchesAny(tokens, SUPPORT_KEYWORDS),
        matchesAny(tokens, URGENCY_KEYWORDS));
  }

  public ExecutionMode mode() {
    if (needsData && needsSupport) return ExecutionMode.SEQUENTIAL;
    if (needsData) return ExecutionMode.DATA_ONLY;
    if (needsSupport) return ExecutionMode.SUPPORT_ONLY;
    return ExecutionMode.NONE;
  }

  /** Lower-case word tokens of a text. */
  public static List<String> tokens(String text) {
    return Arrays.stream(StringUtility.normalize(text).split("[^a-z0-9]+"))
        .filter(t -> !t.isEmpty())
        .toList();
  }

  /**
   * A keyword matches a token that starts with it ("issues" matches "issue"); keywords of two
   * letters or less must match exactly.
   */
  public static boolean matchesAny(List<String> tokens, List<String> keywords) {
    for (String keyword : keywords) {
      String k = StringUtility.normalize(keyword);
      if (k.isEmpty()) continue;
      for (String token : tokens) {
        if (k.length() <= 2 ? token.equals(k) : token.startsWith(k)) {
          return true;
        }
      }
    }
    return false;
  }
}

package com.gentoro.agentrelay.reasoning;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class QueryIntentTest {

  @Test
  void classifiesByKeywords() {
    assertEquals(
        QueryIntent.ExecutionMode.SEQUENTIAL,
        QueryIntent.analyze("Customer 5 has a problem logging in").mode());
    assertEquals(QueryIntent.ExecutionMode.DATA_ONLY, QueryIntent.analyze("List tickets").mode());
    assertEquals(
        QueryIntent.ExecutionMode.SUPPORT_ONLY, QueryIntent.analyze("Please help me").mode());
    assertEquals(QueryIntent.ExecutionMode.NONE, QueryIntent.analyze("hello there").mode());
  }

  @Test
  void detectsUrgency() {
    assertTrue(QueryIntent.analyze("I need this fixed ASAP").urgent());
    assertFalse(QueryIntent.analyze("whenever you can").urgent());
  }

  @Test
  void shortKeywordsMatchWholeTokensOnly() {
    List<String> tokens = QueryIntent.tokens("Idle customers, id: 7");
    assertEquals(List.of("idle", "customers", "id", "7"), tokens);
    assertTrue(QueryIntent.matchesAny(List.of("identity"), List.of("ident")));
    assertFalse(QueryIntent.matchesAny(List.of("idle"), List.of("id")));
    assertTrue(QueryIntent.matchesAny(List.of("issues"), List.of("issue")));
  }
}

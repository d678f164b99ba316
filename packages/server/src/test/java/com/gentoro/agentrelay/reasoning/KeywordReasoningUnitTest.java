package com.gentoro.agentrelay.reasoning;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.backend.InMemorySupportBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.protocol.ToolCall;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeywordReasoningUnitTest {

  private final KeywordReasoningUnit unit = new KeywordReasoningUnit();
  private final InMemorySupportBackend backend =
      InMemorySupportBackend.fromClasspath("seed/support-data.yaml");
  private final OperationCatalog catalog = OperationCatalog.of(backend);

  private List<OperationDefinition> ops(String... names) {
    Set<String> wanted = Set.of(names);
    return catalog.all().stream().filter(d -> wanted.contains(d.name())).toList();
  }

  /** Drives the unit against the backend the way an agent runtime would. */
  private List<ToolCall> run(String query, List<OperationDefinition> operations, Map<String, JsonNode> scratch) {
    List<ToolCall> calls = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      ReasoningStep step =
          unit.next(new ReasoningRequest("agent", "", query, operations, List.of(), scratch, calls));
      if (step.isFinal()) {
        calls.add(new ToolCall("<final>", Map.of(), JacksonUtility.toTree(step.answer())));
        return calls;
      }
      calls.add(new ToolCall(step.operation(), step.args(), backend.execute(step.operation(), step.args())));
    }
    fail("no final answer");
    return calls;
  }

  private static String answer(List<ToolCall> calls) {
    return calls.get(calls.size() - 1).result().asText();
  }

  @Test
  void withoutOperationsTheInstructionIsTheAnswer() {
    ReasoningStep step = unit.next(ReasoningRequest.direct("router", "rendered text", "hello"));
    assertTrue(step.isFinal());
    assertEquals("rendered text", step.answer());
  }

  @Test
  void looksUpCustomerAndCreatesTicket() {
    List<ToolCall> calls =
        run(
            "Check account 5 and create a ticket for billing issues",
            ops("get_customer", "list_tickets", "create_ticket"),
            Map.of());

    assertEquals("get_customer", calls.get(0).operation());
    assertEquals(Map.of("customer_id", 5), calls.get(0).args());
    assertEquals("create_ticket", calls.get(1).operation());
    assertEquals("billing issues", calls.get(1).args().get("issue"));
    assertEquals("medium", calls.get(1).args().get("priority"));
    assertEquals(
        "Customer 5: Emily Chen <emily.chen@example.com>, status active. "
            + "Created ticket #6 for Emily Chen (medium priority): billing issues.",
        answer(calls));
  }

  @Test
  void urgentTicketsGetHighPriority() {
    List<ToolCall> calls =
        run("Urgent: for customer 2, open a ticket about a broken login", ops("create_ticket"), Map.of());
    assertEquals("high", calls.get(0).args().get("priority"));
    assertEquals("broken login", calls.get(0).args().get("issue"));
  }

  @Test
  void picksUpTicketCreatedByAnEarlierAgent() {
    List<ToolCall> dataCalls =
        run(
            "Check account 5 and create a ticket for billing issues",
            ops("get_customer", "create_ticket"),
            Map.of());
    Map<String, Object> dataOutput =
        Map.of("toolCalls", dataCalls.subList(0, dataCalls.size() - 1), "final", true);

    List<ToolCall> supportCalls =
        run(
            "Check account 5 and create a ticket for billing issues",
            ops("get_ticket"),
            Map.of("data", JacksonUtility.toTree(dataOutput)));

    assertEquals("get_ticket", supportCalls.get(0).operation());
    assertEquals(Map.of("ticket_id", 6), supportCalls.get(0).args());
    assertEquals(
        "Ticket #6 for Emily Chen: billing issues (status open, priority medium).",
        answer(supportCalls));
  }

  @Test
  void onlyProposesAllowedOperationsOnce() {
    List<ToolCall> calls = run("Show ticket stats and customer stats", ops("get_ticket_stats"), Map.of());
    assertEquals(List.of("get_ticket_stats", "<final>"), calls.stream().map(ToolCall::operation).toList());
    assertTrue(answer(calls).startsWith("get_ticket_stats: "));
  }

  @Test
  void listsTicketHistory() {
    List<ToolCall> calls =
        run("Show the ticket history for customer 2", ops("list_tickets"), Map.of());
    assertEquals(Map.of("customer_id", 2), calls.get(0).args());
    assertTrue(answer(calls).startsWith("Found 2 tickets: #2 Invoice shows duplicate charge"));
  }

  @Test
  void resolvesTicket() {
    List<ToolCall> calls =
        run("Please resolve ticket 4", ops("update_ticket_status", "get_ticket"), Map.of());
    assertEquals("update_ticket_status", calls.get(0).operation());
    assertEquals("resolved", calls.get(0).args().get("status"));
    assertTrue(answer(calls).contains("status resolved"));
  }

  @Test
  void backendErrorsAreExplained() {
    ToolCall failed =
        new ToolCall(
            "get_customer",
            Map.of("customer_id", 99),
            JacksonUtility.toTree(Map.of("error", Map.of("message", "Customer 99 not found"))));
    assertEquals(
        "Could not complete get_customer: Customer 99 not found.",
        KeywordReasoningUnit.describe(failed));
  }

  @Test
  void nothingToDoIsSaidPlainly() {
    ReasoningStep step =
        unit.next(
            new ReasoningRequest(
                "agent", "", "what's the weather", ops("get_customer"), List.of(), Map.of(), List.of()));
    assertEquals("No matching records or actions were found for: \"what's the weather\"", step.answer());
  }
}

package com.gentoro.agentrelay.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.protocol.ToolCall;
import com.gentoro.agentrelay.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic reasoning unit driven by keywords and numbers found in the query.
 *
 * <p>It proposes the support operations that the query plainly asks for, one per step and each at
 * most once per invocation, restricted to the operations it was given. Ticket ids created by
 * earlier agents are picked up from the scratch space. Once nothing is left to do, it summarizes
 * the results. Without any operation available it answers with the instruction text, so a
 * template-rendered instruction becomes the answer.
 */
public class KeywordReasoningUnit implements ReasoningUnit {
  private static final Pattern CUSTOMER_ID =
      Pattern.compile(
          "(?:customer|account|client)\\s*(?:id)?\\s*(?:#|no\\.?|number)?\\s*:?\\s*(\\d+)"
              + "|\\bid\\s*:?\\s*#?(\\d+)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern TICKET_ID =
      Pattern.compile(
          "ticket\\s*(?:id)?\\s*(?:#|no\\.?|number)?\\s*:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern CREATE_TICKET =
      Pattern.compile(
          "\\b(?:create|open|file|raise|log|submit)\\w*\\s+(?:(?:a|an|new|support)\\s+)*ticket",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern ISSUE =
      Pattern.compile(
          "ticket\\s+(?:for|about|regarding|on)\\s+(?:the\\s+|my\\s+|a\\s+)?(.+?)\\s*(?:[.!?]|$)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern SEARCH =
      Pattern.compile(
          "\\b(?:search|find)\\w*\\s+(?:tickets?\\s+)?(?:for|about|mentioning|with)\\s+\"?([\\w-]+)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern DISABLE =
      Pattern.compile("\\b(?:disable|deactivate|suspend)\\w*\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern ACTIVATE =
      Pattern.compile("\\b(?:re)?(?:activate|enable)\\w*\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern RESOLVE =
      Pattern.compile("\\b(?:resolve|close)\\w*\\b", Pattern.CASE_INSENSITIVE);

  @Override
  public ReasoningStep next(ReasoningRequest request) {
    if (request.operations().isEmpty()) {
      return ReasoningStep.finalAnswer(request.instruction());
    }

    Set<String> allowed =
        request.operations().stream().map(OperationDefinition::name).collect(Collectors.toSet());
    Set<String> done =
        request.toolCalls().stream().map(ToolCall::operation).collect(Collectors.toSet());

    for (Candidate candidate : candidates(request)) {
      if (allowed.contains(candidate.operation()) && !done.contains(candidate.operation())) {
        return ReasoningStep.toolCall(candidate.operation(), candidate.args());
      }
    }
    return ReasoningStep.finalAnswer(summarize(request));
  }

  private List<Candidate> candidates(ReasoningRequest request) {
    String query = request.query();
    List<String> tokens = QueryIntent.tokens(query);
    Optional<Integer> customerId = firstNumber(CUSTOMER_ID, query);
    Optional<Integer> ticketId = firstNumber(TICKET_ID, query).or(() -> ticketFromScratch(request));
    boolean createTicket = CREATE_TICKET.matcher(query).find();
    boolean stats =
        QueryIntent.matchesAny(tokens, List.of("stats", "statistic"))
            || StringUtility.normalize(query).contains("how many");

    List<Candidate> out = new ArrayList<>();
    customerId.ifPresent(id -> out.add(new Candidate("get_customer", Map.of("customer_id", id))));

    if (customerId.isPresent() && DISABLE.matcher(query).find()) {
      out.add(new Candidate("disable_customer", Map.of("customer_id", customerId.get())));
    } else if (customerId.isPresent() && ACTIVATE.matcher(query).find()) {
      out.add(new Candidate("activate_customer", Map.of("customer_id", customerId.get())));
    }

    if (customerId.isEmpty() && tokens.contains("customers") && !stats) {
      Map<String, Object> args = new LinkedHashMap<>();
      if (tokens.contains("active")) args.put("status", "active");
      if (tokens.contains("disabled")) args.put("status", "disabled");
      out.add(new Candidate("list_customers", args));
    }

    if (createTicket && customerId.isPresent()) {
      Map<String, Object> args = new LinkedHashMap<>();
      args.put("customer_id", customerId.get());
      args.put("issue", issueOf(query));
      args.put("priority", QueryIntent.analyze(query).urgent() ? "high" : "medium");
      out.add(new Candidate("create_ticket", args));
    }

    boolean ticketHistory =
        tokens.contains("tickets")
            || tokens.contains("history")
            || (tokens.contains("ticket") && tokens.contains("status"));
    if (!createTicket && customerId.isPresent() && ticketHistory) {
      out.add(new Candidate("list_tickets", Map.of("customer_id", customerId.get())));
    }

    if (ticketId.isPresent() && !createTicket) {
      if (RESOLVE.matcher(query).find()) {
        out.add(
            new Candidate(
                "update_ticket_status",
                Map.of("ticket_id", ticketId.get(), "status", "resolved")));
      }
      out.add(new Candidate("get_ticket", Map.of("ticket_id", ticketId.get())));
    } else if (ticketId.isPresent() && ticketFromScratch(request).isPresent()) {
      out.add(new Candidate("get_ticket", Map.of("ticket_id", ticketId.get())));
    }

    Matcher search = SEARCH.matcher(query);
    if (search.find()) {
      out.add(new Candidate("search_tickets", Map.of("keyword", search.group(1))));
    }

    if (stats) {
      if (tokens.stream().anyMatch(t -> t.startsWith("ticket"))) {
        out.add(new Candidate("get_ticket_stats", Map.of()));
      }
      if (tokens.stream().anyMatch(t -> t.startsWith("customer"))) {
        out.add(new Candidate("get_customer_stats", Map.of()));
      }
    }
    return out;
  }

  private static Optional<Integer> firstNumber(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    if (!m.find()) return Optional.empty();
    for (int g = 1; g <= m.groupCount(); g++) {
      if (m.group(g) != null) {
        return Optional.of(Integer.parseInt(m.group(g)));
      }
    }
    return Optional.empty();
  }

  /** Id of a ticket some earlier agent created, as recorded in its scratch output. */
  private static Optional<Integer> ticketFromScratch(ReasoningRequest request) {
    for (JsonNode output : request.scratch().values()) {
      for (JsonNode call : output.path("toolCalls")) {
        if ("create_ticket".equals(call.path("operation").asText())
            && call.path("result").path("id").isIntegralNumber()) {
          return Optional.of(call.path("result").path("id").asInt());
        }
      }
    }
    return Optional.empty();
  }

  private static String issueOf(String query) {
    Matcher m = ISSUE.matcher(query);
    return m.find() ? m.group(1).trim() : query.trim();
  }

  private static String summarize(ReasoningRequest request) {
    if (request.toolCalls().isEmpty()) {
      return "No matching records or actions were found for: \"%s\"".formatted(request.query());
    }
    return request.toolCalls().stream()
        .map(KeywordReasoningUnit::describe)
        .collect(Collectors.joining(" "));
  }

  static String describe(ToolCall call) {
    JsonNode r = call.result();
    if (r == null || r.isNull()) {
      return "%s returned nothing.".formatted(call.operation());
    }
    if (r.has("error")) {
      return "Could not complete %s: %s."
          .formatted(call.operation(), r.path("error").path("message").asText());
    }
    return switch (call.operation()) {
      case "get_customer", "add_customer", "update_customer" -> "Customer %d: %s <%s>, status %s."
          .formatted(
              r.path("id").asInt(),
              r.path("name").asText(),
              r.path("email").asText(),
              r.path("status").asText());
      case "disable_customer", "activate_customer" -> "Customer %d (%s) is now %s."
          .formatted(r.path("id").asInt(), r.path("name").asText(), r.path("status").asText());
      case "create_ticket" -> "Created ticket #%d for %s (%s priority): %s."
          .formatted(
              r.path("id").asInt(),
              r.path("customer_name").asText(),
              r.path("priority").asText(),
              r.path("issue").asText());
      case "get_ticket", "update_ticket_status", "update_ticket_priority" -> {
        String template = "Ticket #%d for %s: %s (status %s, priority %s).";
        yield template.formatted(
            r.path("id").asInt(),
            r.path("customer_name").asText(),
            r.path("issue").asText(),
            r.path("status").asText(),
            r.path("priority").asText());
      }
      case "list_tickets", "search_tickets" -> describeTickets(r);
      case "list_customers" -> describeCustomers(r);
      case "delete_ticket" -> r.asBoolean() ? "Ticket deleted." : "Ticket was not found.";
      default -> "%s: %s."
          .formatted(call.operation(), StringUtility.truncate(r.toString(), 400));
    };
  }

  private static String describeTickets(JsonNode tickets) {
    if (tickets.size() == 0) return "No tickets found.";
    List<String> items = new ArrayList<>();
    tickets.forEach(
        t ->
            items.add(
                "#%d %s [%s, %s]"
                    .formatted(
                        t.path("id").asInt(),
                        t.path("issue").asText(),
                        t.path("status").asText(),
                        t.path("priority").asText())));
    return "Found %d tickets: %s.".formatted(tickets.size(), String.join("; ", items));
  }

  private static String describeCustomers(JsonNode customers) {
    if (customers.size() == 0) return "No customers found.";
    List<String> items = new ArrayList<>();
    customers.forEach(
        c ->
            items.add(
                "%s (#%d, %s)"
                    .formatted(
                        c.path("name").asText(), c.path("id").asInt(), c.path("status").asText())));
    return "Found %d customers: %s.".formatted(customers.size(), String.join("; ", items));
  }

  private record Candidate(String operation, Map<String, Object> args) {}
}

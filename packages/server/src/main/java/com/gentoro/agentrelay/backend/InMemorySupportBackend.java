package com.gentoro.agentrelay.backend;

import static com.gentoro.agentrelay.backend.ParameterSpec.Type.INTEGER;
import static com.gentoro.agentrelay.backend.ParameterSpec.Type.STRING;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.NotFoundException;
import com.gentoro.agentrelay.exception.SerializationException;
import com.gentoro.agentrelay.exception.ValidationException;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Customer and ticket store kept in memory, exposing the support operations.
 *
 * <p>Customer status is {@code active} or {@code disabled}; ticket status is {@code open}, {@code
 * in_progress} or {@code resolved}; priority is {@code low}, {@code medium} or {@code high}.
 * Tickets are always returned joined with their customer's name, email, phone and status, ordered
 * by priority (high first) and then newest first.
 */
public class InMemorySupportBackend implements OperationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(InMemorySupportBackend.class);

  static final Set<String> CUSTOMER_STATUSES = Set.of("active", "disabled");
  static final Set<String> TICKET_STATUSES = Set.of("open", "in_progress", "resolved");
  static final List<String> PRIORITIES = List.of("high", "medium", "low");

  private static final Comparator<Ticket> TICKET_ORDER =
      Comparator.<Ticket>comparingInt(t -> PRIORITIES.indexOf(t.priority()))
          .thenComparing(Ticket::createdAt, Comparator.reverseOrder())
          .thenComparing(Ticket::id, Comparator.reverseOrder());

  private final Map<Integer, Customer> customers = new TreeMap<>();
  private final Map<Integer, Ticket> tickets = new TreeMap<>();
  private int nextCustomerId = 1;
  private int nextTicketId = 1;

  public InMemorySupportBackend() {}

  /** Create a backend seeded from a YAML document on the classpath. */
  public static InMemorySupportBackend fromClasspath(String resource) {
    InMemorySupportBackend backend = new InMemorySupportBackend();
    try (InputStream in =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Seed data not found on classpath: " + resource);
      }
      Seed seed = JacksonUtility.getYamlMapper().readValue(in, Seed.class);
      backend.load(seed);
    } catch (IOException e) {
      throw new SerializationException("Failed to read seed data: " + resource, e);
    }
    return backend;
  }

  synchronized void load(Seed seed) {
    if (seed.customers() != null) {
      for (Customer c : seed.customers()) {
        requireOneOf("status", c.status(), CUSTOMER_STATUSES);
        customers.put(c.id(), c);
        nextCustomerId = Math.max(nextCustomerId, c.id() + 1);
      }
    }
    if (seed.tickets() != null) {
      for (Ticket t : seed.tickets()) {
        requireCustomer(t.customerId());
        requireOneOf("status", t.status(), TICKET_STATUSES);
        requireOneOf("priority", t.priority(), PRIORITIES);
        tickets.put(t.id(), t);
        nextTicketId = Math.max(nextTicketId, t.id() + 1);
      }
    }
    log.info(
        "Support backend seeded with {} customers and {} tickets",
        customers.size(),
        tickets.size());
  }

  @Override
  public List<OperationDefinition> listOperations() {
    return DEFINITIONS;
  }

  @Override
  public synchronized JsonNode execute(String operation, Map<String, Object> args) {
    log.debug("Executing {} with {}", operation, args);
    return switch (operation) {
      case "get_customer" -> customerNode(requireCustomer(intArg(args, "customer_id")));
      case "list_customers" -> listCustomers(stringArg(args, "status"));
      case "add_customer" -> addCustomer(args);
      case "update_customer" -> updateCustomer(args);
      case "disable_customer" -> setCustomerStatus(intArg(args, "customer_id"), "disabled");
      case "activate_customer" -> setCustomerStatus(intArg(args, "customer_id"), "active");
      case "get_ticket" -> ticketNode(requireTicket(intArg(args, "ticket_id")));
      case "list_tickets" -> listTickets(args);
      case "create_ticket" -> createTicket(args);
      case "update_ticket_status" -> updateTicket(
          intArg(args, "ticket_id"), requiredString(args, "status"), null);
      case "update_ticket_priority" -> updateTicket(
          intArg(args, "ticket_id"), null, requiredString(args, "priority"));
      case "delete_ticket" -> BooleanNode.valueOf(tickets.remove(intArg(args, "ticket_id")) != null);
      case "get_ticket_stats" -> ticketStats();
      case "get_customer_stats" -> customerStats();
      case "search_tickets" -> searchTickets(requiredString(args, "keyword"));
      default -> throw new NotFoundException("Unknown operation: " + operation);
    };
  }

  private JsonNode listCustomers(String status) {
    if (status != null) requireOneOf("status", status, CUSTOMER_STATUSES);
    ArrayNode out = JacksonUtility.getJsonMapper().createArrayNode();
    customers.values().stream()
        .filter(c -> status == null || status.equals(c.status()))
        .sorted(Comparator.comparing(Customer::name).thenComparing(Customer::id))
        .forEach(c -> out.add(customerNode(c)));
    return out;
  }

  private JsonNode addCustomer(Map<String, Object> args) {
    String status = defaultString(args, "status", "active");
    requireOneOf("status", status, CUSTOMER_STATUSES);
    Instant now = Instant.now();
    Customer customer =
        new Customer(
            nextCustomerId++,
            requiredString(args, "name"),
            stringArg(args, "email"),
            stringArg(args, "phone"),
            status,
            now,
            now);
    customers.put(customer.id(), customer);
    return customerNode(customer);
  }

  private JsonNode updateCustomer(Map<String, Object> args) {
    Customer current = requireCustomer(intArg(args, "customer_id"));
    String name = stringArg(args, "name");
    String email = stringArg(args, "email");
    String phone = stringArg(args, "phone");
    if (name == null && email == null && phone == null) {
      throw new ValidationException("No fields to update for customer " + current.id());
    }
    Customer updated =
        new Customer(
            current.id(),
            name == null ? current.name() : name,
            email == null ? current.email() : email,
            phone == null ? current.phone() : phone,
            current.status(),
            current.createdAt(),
            Instant.now());
    customers.put(updated.id(), updated);
    return customerNode(updated);
  }

  private JsonNode setCustomerStatus(int customerId, String status) {
    Customer current = requireCustomer(customerId);
    Customer updated =
        new Customer(
            current.id(),
            current.name(),
            current.email(),
            current.phone(),
            status,
            current.createdAt(),
            Instant.now());
    customers.put(updated.id(), updated);
    return customerNode(updated);
  }

  private JsonNode listTickets(Map<String, Object> args) {
    String status = stringArg(args, "status");
    String priority = stringArg(args, "priority");
    Integer customerId = args.get("customer_id") == null ? null : intArg(args, "customer_id");
    if (status != null) requireOneOf("status", status, TICKET_STATUSES);
    if (priority != null) requireOneOf("priority", priority, PRIORITIES);
    return ticketsMatching(
        t ->
            (status == null || status.equals(t.status()))
                && (priority == null || priority.equals(t.priority()))
                && (customerId == null || customerId == t.customerId()));
  }

  private JsonNode createTicket(Map<String, Object> args) {
    Customer customer = requireCustomer(intArg(args, "customer_id"));
    String priority = defaultString(args, "priority", "medium");
    String status = defaultString(args, "status", "open");
    requireOneOf("priority", priority, PRIORITIES);
    requireOneOf("status", status, TICKET_STATUSES);
    Ticket ticket =
        new Ticket(
            nextTicketId++,
            customer.id(),
            requiredString(args, "issue"),
            status,
            priority,
            Instant.now());
    tickets.put(ticket.id(), ticket);
    return ticketNode(ticket);
  }

  private JsonNode updateTicket(int ticketId, String status, String priority) {
    Ticket current = requireTicket(ticketId);
    if (status != null) requireOneOf("status", status, TICKET_STATUSES);
    if (priority != null) requireOneOf("priority", priority, PRIORITIES);
    Ticket updated =
        new Ticket(
            current.id(),
            current.customerId(),
            current.issue(),
            status == null ? current.status() : status,
            priority == null ? current.priority() : priority,
            current.createdAt());
    tickets.put(updated.id(), updated);
    return ticketNode(updated);
  }

  private JsonNode searchTickets(String keyword) {
    String needle = keyword.toLowerCase(Locale.ROOT);
    return ticketsMatching(t -> t.issue().toLowerCase(Locale.ROOT).contains(needle));
  }

  private JsonNode ticketStats() {
    ObjectNode out = JacksonUtility.getJsonMapper().createObjectNode();
    out.put("total_tickets", tickets.size());
    out.set("by_status", countBy(tickets.values().stream().map(Ticket::status).toList()));
    out.set("by_priority", countBy(tickets.values().stream().map(Ticket::priority).toList()));
    return out;
  }

  private JsonNode customerStats() {
    ObjectNode out = JacksonUtility.getJsonMapper().createObjectNode();
    out.put("total_customers", customers.size());
    out.set("by_status", countBy(customers.values().stream().map(Customer::status).toList()));
    return out;
  }

  private ObjectNode countBy(List<String> values) {
    Map<String, Integer> counts = new TreeMap<>();
    values.forEach(v -> counts.merge(v, 1, Integer::sum));
    ObjectNode out = JacksonUtility.getJsonMapper().createObjectNode();
    counts.forEach(out::put);
    return out;
  }

  private JsonNode ticketsMatching(Predicate<Ticket> filter) {
    ArrayNode out = JacksonUtility.getJsonMapper().createArrayNode();
    tickets.values().stream()
        .filter(filter)
        .sorted(TICKET_ORDER)
        .forEach(t -> out.add(ticketNode(t)));
    return out;
  }

  private Customer requireCustomer(int customerId) {
    Customer customer = customers.get(customerId);
    if (customer == null) {
      throw NotFoundException.record("Customer", customerId);
    }
    return customer;
  }

  private Ticket requireTicket(int ticketId) {
    Ticket ticket = tickets.get(ticketId);
    if (ticket == null) {
      throw NotFoundException.record("Ticket", ticketId);
    }
    return ticket;
  }

  private ObjectNode customerNode(Customer c) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("id", c.id());
    node.put("name", c.name());
    node.put("email", c.email());
    node.put("phone", c.phone());
    node.put("status", c.status());
    node.put("created_at", String.valueOf(c.createdAt()));
    node.put("updated_at", String.valueOf(c.updatedAt()));
    return node;
  }

  private ObjectNode ticketNode(Ticket t) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("id", t.id());
    node.put("customer_id", t.customerId());
    node.put("issue", t.issue());
    node.put("status", t.status());
    node.put("priority", t.priority());
    node.put("created_at", String.valueOf(t.createdAt()));
    Customer c = customers.get(t.customerId());
    if (c != null) {
      node.put("customer_name", c.name());
      node.put("customer_email", c.email());
      node.put("customer_phone", c.phone());
      node.put("customer_status", c.status());
    }
    return node;
  }

  private static void requireOneOf(String field, String value, Collection<String> allowed) {
    if (value == null || !allowed.contains(value)) {
      throw new ValidationException(
          "Invalid %s '%s', expected one of %s".formatted(field, value, allowed));
    }
  }

  private static int intArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (value instanceof Number n) {
      return n.intValue();
    }
    throw new ValidationException("Argument '%s' must be an integer".formatted(name));
  }

  private static String stringArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    return value == null ? null : value.toString();
  }

  private static String requiredString(Map<String, Object> args, String name) {
    String value = stringArg(args, name);
    if (value == null || value.isBlank()) {
      throw new ValidationException("Argument '%s' is required".formatted(name));
    }
    return value;
  }

  private static String defaultString(Map<String, Object> args, String name, String fallback) {
    String value = stringArg(args, name);
    return value == null || value.isBlank() ? fallback : value;
  }

  record Customer(
      int id,
      String name,
      String email,
      String phone,
      String status,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt) {
    Customer {
      status = status == null ? "active" : status;
      createdAt = createdAt == null ? Instant.now() : createdAt;
      updatedAt = updatedAt == null ? createdAt : updatedAt;
    }
  }

  record Ticket(
      int id,
      @JsonProperty("customer_id") int customerId,
      String issue,
      String status,
      String priority,
      @JsonProperty("created_at") Instant createdAt) {
    Ticket {
      status = status == null ? "open" : status;
      priority = priority == null ? "medium" : priority;
      createdAt = createdAt == null ? Instant.now() : createdAt;
    }
  }

  record Seed(List<Customer> customers, List<Ticket> tickets) {}

  static final List<OperationDefinition> DEFINITIONS =
      List.of(
          OperationDefinition.builder("get_customer")
              .description("Retrieve a customer by id")
              .required("customer_id", INTEGER, "Customer id")
              .returns("customer")
              .build(),
          OperationDefinition.builder("list_customers")
              .description("List customers, optionally filtered by status (active, disabled)")
              .optional("status", STRING, "Customer status filter")
              .returns("customer[]")
              .build(),
          OperationDefinition.builder("add_customer")
              .description("Create a new customer")
              .required("name", STRING, "Full name")
              .optional("email", STRING, "Email address")
              .optional("phone", STRING, "Phone number")
              .optional("status", STRING, "Initial status, defaults to active")
              .returns("customer")
              .mutates(true)
              .build(),
          OperationDefinition.builder("update_customer")
              .description("Update a customer's name, email or phone")
              .required("customer_id", INTEGER, "Customer id")
              .optional("name", STRING, "New name")
              .optional("email", STRING, "New email")
              .optional("phone", STRING, "New phone")
              .returns("customer")
              .mutates(true)
              .build(),
          OperationDefinition.builder("disable_customer")
              .description("Disable a customer account")
              .required("customer_id", INTEGER, "Customer id")
              .returns("customer")
              .mutates(true)
              .build(),
          OperationDefinition.builder("activate_customer")
              .description("Re-activate a disabled customer account")
              .required("customer_id", INTEGER, "Customer id")
              .returns("customer")
              .mutates(true)
              .build(),
          OperationDefinition.builder("get_ticket")
              .description("Retrieve a ticket with its customer details")
              .required("ticket_id", INTEGER, "Ticket id")
              .returns("ticket")
              .build(),
          OperationDefinition.builder("list_tickets")
              .description("List tickets by status, priority or customer, highest priority first")
              .optional("status", STRING, "open, in_progress or resolved")
              .optional("priority", STRING, "low, medium or high")
              .optional("customer_id", INTEGER, "Customer id")
              .returns("ticket[]")
              .build(),
          OperationDefinition.builder("create_ticket")
              .description("Open a support ticket for a customer")
              .required("customer_id", INTEGER, "Customer id")
              .required("issue", STRING, "Issue description")
              .optional("priority", STRING, "low, medium (default) or high")
              .optional("status", STRING, "Initial status, defaults to open")
              .returns("ticket")
              .mutates(true)
              .build(),
          OperationDefinition.builder("update_ticket_status")
              .description("Change the status of a ticket")
              .required("ticket_id", INTEGER, "Ticket id")
              .required("status", STRING, "open, in_progress or resolved")
              .returns("ticket")
              .mutates(true)
              .build(),
          OperationDefinition.builder("update_ticket_priority")
              .description("Change the priority of a ticket")
              .required("ticket_id", INTEGER, "Ticket id")
              .required("priority", STRING, "low, medium or high")
              .returns("ticket")
              .mutates(true)
              .build(),
          OperationDefinition.builder("delete_ticket")
              .description("Delete a ticket permanently")
              .required("ticket_id", INTEGER, "Ticket id")
              .returns("boolean")
              .mutates(true)
              .build(),
          OperationDefinition.builder("get_ticket_stats")
              .description("Ticket counts by status and priority")
              .returns("ticket_stats")
              .build(),
          OperationDefinition.builder("get_customer_stats")
              .description("Customer counts by status")
              .returns("customer_stats")
              .build(),
          OperationDefinition.builder("search_tickets")
              .description("Find tickets whose issue mentions a keyword")
              .required("keyword", STRING, "Case-insensitive keyword")
              .returns("ticket[]")
              .build());
}

package com.gentoro.agentrelay.broker;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.agentrelay.backend.OperationBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.backend.ParameterSpec;
import com.gentoro.agentrelay.exception.BackendException;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.UnauthorizedException;
import com.gentoro.agentrelay.exception.ValidationException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ToolBrokerTest {

  @Mock OperationBackend backend;

  private ToolBroker broker;
  private final ToolBinding support = ToolBinding.of("support", Set.of("get_ticket", "create_ticket"));

  @BeforeEach
  void setUp() {
    OperationCatalog catalog =
        new OperationCatalog(
            List.of(
                OperationDefinition.builder("get_ticket")
                    .required("ticket_id", ParameterSpec.Type.INTEGER, "Ticket id")
                    .build(),
                OperationDefinition.builder("create_ticket")
                    .required("customer_id", ParameterSpec.Type.INTEGER, "Customer id")
                    .required("issue", ParameterSpec.Type.STRING, "Issue")
                    .optional("priority", ParameterSpec.Type.STRING, "Priority")
                    .mutates(true)
                    .build(),
                OperationDefinition.builder("delete_ticket")
                    .required("ticket_id", ParameterSpec.Type.INTEGER, "Ticket id")
                    .mutates(true)
                    .build()));
    broker = new ToolBroker(catalog, backend, Duration.ofMillis(1));
  }

  @Test
  @DisplayName("operations outside the binding are refused without touching the backend")
  void unauthorizedNeverReachesBackend() {
    UnauthorizedException ex =
        assertThrows(
            UnauthorizedException.class,
            () -> broker.invoke(support, "delete_ticket", Map.of("ticket_id", 1)));
    assertEquals("support", ex.getContext().get("agentId"));
    verify(backend, never()).execute(any(), anyMap());
  }

  @Test
  void invalidArgumentsAreRejectedBeforeTheCall() {
    assertThrows(
        ValidationException.class,
        () -> broker.invoke(support, "get_ticket", Map.of("ticket_id", "seven")));
    assertThrows(ValidationException.class, () -> broker.invoke(support, "get_ticket", Map.of()));
    assertThrows(
        ValidationException.class,
        () -> broker.invoke(support, "get_ticket", Map.of("ticket_id", 1, "extra", true)));
    verify(backend, never()).execute(any(), anyMap());
  }

  @Test
  void readOperationIsRetriedOnceAndReturnsTheSingleCallResult() {
    JsonNode value = TextNode.valueOf("ticket");
    when(backend.execute(eq("get_ticket"), anyMap()))
        .thenThrow(new BackendException("get_ticket", "flaky"))
        .thenReturn(value);

    assertEquals(value, broker.invoke(support, "get_ticket", Map.of("ticket_id", 1)));
    verify(backend, times(2)).execute(eq("get_ticket"), anyMap());
  }

  @Test
  void readOperationFailsAfterOneRetry() {
    when(backend.execute(eq("get_ticket"), anyMap()))
        .thenThrow(new BackendException("get_ticket", "down"));

    assertThrows(
        BackendException.class, () -> broker.invoke(support, "get_ticket", Map.of("ticket_id", 1)));
    verify(backend, times(2)).execute(eq("get_ticket"), anyMap());
  }

  @Test
  void mutatingOperationIsInvokedAtMostOnce() {
    when(backend.execute(eq("create_ticket"), anyMap()))
        .thenThrow(new IllegalStateException("write failed"));

    BackendException ex =
        assertThrows(
            BackendException.class,
            () ->
                broker.invoke(support, "create_ticket", Map.of("customer_id", 5, "issue", "billing")));
    assertEquals("create_ticket", ex.getOperation());
    verify(backend, times(1)).execute(eq("create_ticket"), anyMap());
  }

  @Test
  void bindingsNamingUnknownOperationsFailValidation() {
    broker.validateBindings(List.of(support));
    assertThrows(
        ConfigException.class,
        () -> broker.validateBindings(List.of(ToolBinding.of("x", Set.of("drop_database")))));
  }

  @Test
  void operationsForFiltersCatalogByBinding() {
    assertEquals(
        List.of("get_ticket", "create_ticket"),
        broker.operationsFor(support).stream().map(OperationDefinition::name).toList());
  }
}

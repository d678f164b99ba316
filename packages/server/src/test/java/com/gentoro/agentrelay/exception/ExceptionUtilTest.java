package com.gentoro.agentrelay.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void stageFailureDetailsNameTheAgent() {
    StageFailureException failure =
        new StageFailureException(
            "customer_data",
            new UnreachableException("customer_data", "connection refused", true, null));

    ErrorDetails details = ExceptionUtil.toErrorDetails(failure);

    assertEquals(AgentRelayErrorCode.STAGE_FAILURE, details.code);
    assertEquals("StageFailureException", details.type);
    assertEquals("customer_data", details.agentId);
    assertEquals("Stage 'customer_data' failed: connection refused", details.message);
    assertEquals("STAGE_FAILURE [customer_data]: " + details.message, details.toString());
  }

  @Test
  void foreignExceptionsAreUnknownAndSerializeWithoutAgent() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(AgentRelayErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertNull(details.agentId);

    JsonNode json = JacksonUtility.toTree(details);
    assertEquals("UNKNOWN", json.path("code").asText());
    assertFalse(json.has("agentId"));
  }

  @Test
  void asAgentRelayExceptionKeepsOwnExceptions() {
    ConfigException own = new ConfigException("bad");
    assertSame(own, ExceptionUtil.asAgentRelayException(own, t -> new ExecutionException("x", t)));

    AgentRelayException wrapped =
        ExceptionUtil.asAgentRelayException(
            new IllegalArgumentException("nope"), t -> new ExecutionException("wrapped", t));
    assertInstanceOf(ExecutionException.class, wrapped);
    assertInstanceOf(IllegalArgumentException.class, wrapped.getCause());
  }

  @Test
  void unwrapAndDescribe() {
    RuntimeException root = new RuntimeException("socket closed");
    Throwable nested =
        new CompletionException(new java.util.concurrent.ExecutionException(root));

    assertSame(root, ExceptionUtil.unwrap(nested));
    assertEquals("socket closed", ExceptionUtil.describe(root));
    assertEquals("NullPointerException", ExceptionUtil.describe(new NullPointerException()));
    assertEquals("unknown error", ExceptionUtil.describe(null));
  }

  @Test
  void errorCodeOfReadsTheRemotePayload() {
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
    payload.putObject("error").put("code", "PERMISSION_DENIED").put("message", "no");

    assertEquals(
        AgentRelayErrorCode.PERMISSION_DENIED,
        ExceptionUtil.errorCodeOf(new RemoteAgentException("b", 403, payload)));
    assertEquals(
        AgentRelayErrorCode.REMOTE_ERROR,
        ExceptionUtil.errorCodeOf(
            new RemoteAgentException("b", 500, JacksonUtility.getJsonMapper().createObjectNode())));
    assertEquals(
        AgentRelayErrorCode.INVALID_ARGUMENT,
        ExceptionUtil.errorCodeOf(new ValidationException("bad")));
    assertEquals(AgentRelayErrorCode.UNKNOWN, ExceptionUtil.errorCodeOf(new RuntimeException()));

    assertTrue(ExceptionUtil.isConfigurationFault(AgentRelayErrorCode.PERMISSION_DENIED));
    assertFalse(ExceptionUtil.isConfigurationFault(AgentRelayErrorCode.UNAVAILABLE));
  }

  @Test
  void toStringNamesCodeAndAgent() {
    StageFailureException failure =
        new StageFailureException(
            "customer_data",
            AgentRelayErrorCode.PERMISSION_DENIED,
            new UnauthorizedException("customer_data", "delete_ticket"));

    assertEquals("customer_data", failure.getAgentId());
    assertEquals(
        "StageFailureException[PERMISSION_DENIED @customer_data]: "
            + failure.getMessage()
            + " (caused by UnauthorizedException)",
        failure.toString());
    assertEquals("ConfigException[CONFIGURATION_ERROR]: bad", new ConfigException("bad").toString());
  }
}

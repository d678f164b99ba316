package com.gentoro.agentrelay.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.exception.DiscoveryException;
import com.gentoro.agentrelay.exception.NotFoundException;
import com.gentoro.agentrelay.exception.ValidationException;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.io.IOException;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Turns a {@link DescriptorReference} into an {@link AgentDescriptor}.
 *
 * <p>Discovery references are fetched from {@value #WELL_KNOWN_PATH} under the base URL. A 404 is
 * reported as {@link NotFoundException}; every other failure (network, status, malformed document)
 * as {@link DiscoveryException}. Relative endpoints are resolved against the base URL. The
 * resolver keeps no state; callers cache results for as long as they see fit.
 */
public class DescriptorResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(DescriptorResolver.class);

  public static final String WELL_KNOWN_PATH = "/.well-known/agent-card.json";

  private final OkHttpClient httpClient;

  public DescriptorResolver(OkHttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  public AgentDescriptor resolve(DescriptorReference reference) {
    if (reference == null) {
      throw new NotFoundException("No descriptor reference given");
    }
    if (reference.isInline()) {
      return reference.inline();
    }
    String baseUrl = reference.baseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new NotFoundException("Descriptor reference has neither inline content nor URL");
    }
    return fetch(baseUrl.trim());
  }

  private AgentDescriptor fetch(String baseUrl) {
    String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    HttpUrl url = HttpUrl.parse(trimmed + WELL_KNOWN_PATH);
    if (url == null) {
      throw new DiscoveryException("Invalid discovery URL: " + baseUrl);
    }

    log.debug("Fetching agent descriptor from {}", url);
    Request request = new Request.Builder().url(url).get().build();
    String body;
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() == 404) {
        throw new NotFoundException("No agent descriptor published at " + url);
      }
      if (!response.isSuccessful()) {
        throw new DiscoveryException(
            "Descriptor fetch from %s failed with status %d".formatted(url, response.code()));
      }
      ResponseBody responseBody = response.body();
      body = responseBody == null ? "" : responseBody.string();
    } catch (IOException e) {
      throw new DiscoveryException("Could not fetch agent descriptor from " + url, e);
    }

    AgentDescriptor descriptor = parse(url, HttpUrl.get(trimmed + "/"), body);
    log.debug("Resolved agent '{}' at {}", descriptor.agentId(), descriptor.endpoint());
    return descriptor;
  }

  private AgentDescriptor parse(HttpUrl url, HttpUrl base, String body) {
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(body);
    } catch (IOException e) {
      throw new DiscoveryException("Descriptor at %s is not valid JSON".formatted(url), e);
    }
    if (node == null || !node.isObject()) {
      throw new DiscoveryException("Descriptor at %s is not a JSON object".formatted(url));
    }

    AgentDescriptor descriptor;
    try {
      descriptor = JacksonUtility.getJsonMapper().treeToValue(node, AgentDescriptor.class);
    } catch (IOException | IllegalArgumentException | ValidationException e) {
      throw new DiscoveryException(
          "Descriptor at %s is malformed: %s".formatted(url, e.getMessage()), e);
    }

    HttpUrl endpoint = HttpUrl.parse(descriptor.endpoint());
    if (endpoint == null) {
      HttpUrl resolved = base.resolve(descriptor.endpoint());
      if (resolved == null) {
        throw new DiscoveryException(
            "Descriptor at %s declares an unusable endpoint '%s'"
                .formatted(url, descriptor.endpoint()));
      }
      descriptor = descriptor.withEndpoint(resolved.toString());
    }
    return descriptor;
  }
}

package com.gentoro.agentrelay.http;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs outgoing discovery and invocation calls. DEBUG writes one line per exchange; TRACE adds
 * headers and bodies, with credentials masked. NDJSON response bodies are never peeked since the
 * proxy reads them as a stream.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final Set<String> MASKED =
      Set.of("authorization", "proxy-authorization", "cookie");
  private static final long MAX_PEEK_BYTES = 64 * 1024;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }
    if (log.isTraceEnabled()) {
      log.trace(
          "{} {} request headers:\n{}body:\n{}",
          request.method(),
          request.url(),
          describe(request.headers()),
          bodyToString(request));
    }

    long started = System.nanoTime();
    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug(
          "{} {} failed after {} ms: {}",
          request.method(),
          request.url(),
          millisSince(started),
          e.toString());
      throw e;
    }
    log.debug(
        "{} {} -> {} in {} ms",
        request.method(),
        request.url(),
        response.code(),
        millisSince(started));

    if (log.isTraceEnabled()) {
      log.trace("Response headers:\n{}", describe(response.headers()));
      if (!isStream(response)) {
        log.trace("Response body:\n{}", response.peekBody(MAX_PEEK_BYTES).string());
      }
    }
    return response;
  }

  private static String millisSince(long startedNanos) {
    return String.format(Locale.ROOT, "%.1f", (System.nanoTime() - startedNanos) / 1e6d);
  }

  private static String describe(Headers headers) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = MASKED.contains(name.toLowerCase(Locale.ROOT)) ? "***" : headers.value(i);
      out.append(name).append(": ").append(value).append('\n');
    }
    return out.toString();
  }

  private static boolean isStream(Response response) {
    ResponseBody body = response.body();
    MediaType type = body == null ? null : body.contentType();
    return type != null && type.subtype().contains("ndjson");
  }

  private static String bodyToString(Request request) {
    if (request.body() == null) return "";
    Buffer buffer = new Buffer();
    try {
      request.body().writeTo(buffer);
    } catch (IOException e) {
      log.trace("Request body of {} could not be read for logging", request.url(), e);
      return "(unreadable)";
    }
    return buffer.readUtf8();
  }
}

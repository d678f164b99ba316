package com.gentoro.agentrelay.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OkHttpFactory {

  /**
   * Shared outbound client. Per-call deadlines are applied by callers through {@code
   * newBuilder().callTimeout(...)}, which reuses this client's connection pool.
   *
   * <p>Keys: {@code http.client.connect-timeout-ms} (default 5000), {@code
   * http.client.read-timeout-ms} (default 30000).
   */
  public static OkHttpClient create(Configuration cfg) {
    return create(
        cfg.getLong("http.client.connect-timeout-ms", 5_000L),
        cfg.getLong("http.client.read-timeout-ms", 30_000L));
  }

  public static OkHttpClient create(long connectTimeoutMs, long readTimeoutMs) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
        .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}

package com.gentoro.agentrelay.http;

import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join) and exposes the context handler
 * so that agent hosts, the actuator and the MCP endpoint can register their servlets before the
 * server starts. Port {@code 0} binds an ephemeral port; {@link #getPort()} reports the actual one
 * once started.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private final Object lifecycleLock = new Object();
  private final String hostname;
  private final int configuredPort;
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this(resolveHostname(configuration), resolvePort(configuration));
  }

  public EmbeddedJettyServer(String hostname, int port) {
    this.hostname = hostname;
    this.configuredPort = port;
  }

  private static int resolvePort(Configuration configuration) {
    try {
      return configuration.getInt("http.port", 8080);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve http.port configuration", e);
    }
  }

  private static String resolveHostname(Configuration configuration) {
    String hostname = configuration.getString("http.hostname", "0.0.0.0");
    if (hostname == null || hostname.isBlank()) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    return hostname.trim();
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      server = new Server();
      connector = new ServerConnector(server);
      if (!"0.0.0.0".equals(hostname)) {
        connector.setHost(hostname);
      }
      connector.setPort(configuredPort);
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        log.info("Starting Jetty server on {}:{}...", hostname, configuredPort);
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.asAgentRelayException(
            e,
            (ex) ->
                new ExecutionException(
                    "Could not start the HTTP listener on %s:%d, check that the port is free"
                        .formatted(hostname, configuredPort),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          // Logged only, so that other services can still stop.
          log.error("Error stopping jetty server", e);
        } finally {
          server = null;
          connector = null;
          contextHandler = null;
        }
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (connector != null && connector.getLocalPort() > 0) {
        return connector.getLocalPort();
      }
      return configuredPort;
    }
  }

  /** Base URL clients on this host can use, e.g. {@code http://localhost:8080}. */
  public String baseUrl() {
    return "http://localhost:" + getPort();
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}

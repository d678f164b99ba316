package com.gentoro.agentrelay;

public class AgentRelayApp {

  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(AgentRelayApp.class);

  public static void main(String[] args) {
    try {
      AgentRelay app = new AgentRelay(args);
      app.initialize();
      if ("server".equals(app.startupParameters().mode())) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

package com.gentoro.agentrelay.reasoning;

import org.apache.commons.configuration2.Configuration;

public class KeywordReasoningUnitProvider implements ReasoningUnitProvider {
  @Override
  public String providerId() {
    return "keyword";
  }

  @Override
  public ReasoningUnit create(Configuration configuration) {
    return new KeywordReasoningUnit();
  }
}

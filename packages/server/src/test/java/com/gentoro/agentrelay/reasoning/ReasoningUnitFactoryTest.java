package com.gentoro.agentrelay.reasoning;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.exception.ConfigException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class ReasoningUnitFactoryTest {

  @Test
  void defaultsToKeywordProvider() {
    assertInstanceOf(KeywordReasoningUnit.class, ReasoningUnitFactory.create(new BaseConfiguration()));
  }

  @Test
  void unknownProviderListsAvailableOnes() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("reasoning.provider", "oracle");
    ConfigException ex = assertThrows(ConfigException.class, () -> ReasoningUnitFactory.create(cfg));
    assertTrue(ex.getMessage().contains("keyword"), ex.getMessage());
  }
}

package com.gentoro.agentrelay.router;

import java.util.List;

/** Merges the outcomes of a fan-out into one answer. Inputs arrive in registry order. */
@FunctionalInterface
public interface Synthesizer {
  String synthesize(String query, List<SynthesisInput> inputs);
}

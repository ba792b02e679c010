package com.aiadvent.ci.eval;

import com.aiadvent.ci.llm.Intent;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One labelled example of the intent golden set. */
public record GoldenCase(
    @JsonProperty("id") String id,
    @JsonProperty("input_text") String inputText,
    @JsonProperty("expected_intent") Intent expectedIntent) {}

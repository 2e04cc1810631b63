package com.agentcrew.orchestrator.sourcehost;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestRef(int number, @JsonProperty("html_url") String url) {}

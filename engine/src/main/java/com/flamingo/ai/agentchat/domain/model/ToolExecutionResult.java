package com.flamingo.ai.agentchat.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Outcome of a tool execution as reported on a tool end event. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecutionResult(boolean success, String output, String error) {}

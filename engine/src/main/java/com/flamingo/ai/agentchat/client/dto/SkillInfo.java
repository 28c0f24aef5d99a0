package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Skill advertised to the agent when a session is created. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillInfo(String name, String description, String path) {}

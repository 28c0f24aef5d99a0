package com.flamingo.ai.agentchat.api.rest;

import com.flamingo.ai.agentchat.client.dto.ProcessStatus;
import com.flamingo.ai.agentchat.service.process.AgentProcessService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the agent process lifecycle. */
@RestController
@RequestMapping("/api/agent/process")
@RequiredArgsConstructor
public class AgentProcessController {

  private final AgentProcessService agentProcessService;

  @GetMapping("/status")
  public ResponseEntity<ProcessStatus> status() {
    return ResponseEntity.ok(agentProcessService.status());
  }

  @PostMapping("/start")
  public ResponseEntity<ProcessStatus> start() {
    return ResponseEntity.ok(agentProcessService.start());
  }

  @PostMapping("/stop")
  public ResponseEntity<ProcessStatus> stop() {
    return ResponseEntity.ok(agentProcessService.stop());
  }
}

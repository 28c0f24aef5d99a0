package com.flamingo.ai.agentchat.api.rest;

import com.flamingo.ai.agentchat.domain.model.Topic;
import com.flamingo.ai.agentchat.service.chat.ConversationEngine;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for topics (agent sessions). */
@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
public class TopicController {

  private final ConversationEngine conversationEngine;

  /** Lists topics, refreshed from the agent. */
  @GetMapping
  public ResponseEntity<List<Topic>> getTopics() {
    return ResponseEntity.ok(conversationEngine.loadTopics());
  }

  /** Makes a topic the active one and loads its history. */
  @PostMapping("/{sessionId}/switch")
  public ResponseEntity<Void> switchTopic(@PathVariable String sessionId) {
    conversationEngine.switchTopic(sessionId);
    return ResponseEntity.noContent().build();
  }

  /** Deletes a topic. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteTopic(@PathVariable String sessionId) {
    conversationEngine.deleteTopic(sessionId);
    return ResponseEntity.noContent().build();
  }
}

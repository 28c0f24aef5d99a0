package com.flamingo.ai.agentchat.api.rest;

import com.flamingo.ai.agentchat.api.dto.request.ChatRequest;
import com.flamingo.ai.agentchat.api.dto.request.EditMessageRequest;
import com.flamingo.ai.agentchat.api.dto.request.UpdateModelRequest;
import com.flamingo.ai.agentchat.api.dto.request.UpdateProviderRequest;
import com.flamingo.ai.agentchat.api.dto.request.UpdateSystemPromptRequest;
import com.flamingo.ai.agentchat.api.dto.response.EngineStateResponse;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.service.chat.ConversationEngine;
import com.flamingo.ai.agentchat.service.chat.SendFlags;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the conversation transcript and engine settings. */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

  private final ConversationEngine conversationEngine;

  /** Gets the current transcript. */
  @GetMapping("/messages")
  public ResponseEntity<List<Message>> getMessages() {
    return ResponseEntity.ok(conversationEngine.getMessages());
  }

  /**
   * Sends a message. Returns once the message is accepted; the response streams in through
   * {@code GET /api/chat/events}.
   */
  @PostMapping("/messages")
  public ResponseEntity<EngineStateResponse> sendMessage(@Valid @RequestBody ChatRequest request) {
    conversationEngine.sendMessage(
        request.getMessage(),
        request.getImages(),
        new SendFlags(request.isWebSearch(), request.isThinking()));
    return ResponseEntity.accepted().body(EngineStateResponse.from(conversationEngine));
  }

  /** Stops the response currently streaming. */
  @PostMapping("/stop")
  public ResponseEntity<Void> stop() {
    conversationEngine.stopSending();
    return ResponseEntity.noContent().build();
  }

  /** Starts a new topic. */
  @PostMapping("/clear")
  public ResponseEntity<Void> clear() {
    conversationEngine.clearMessages();
    return ResponseEntity.noContent().build();
  }

  /** Removes a message from the local transcript. */
  @DeleteMapping("/messages/{messageId}")
  public ResponseEntity<Void> deleteMessage(@PathVariable String messageId) {
    conversationEngine.deleteMessage(messageId);
    return ResponseEntity.noContent().build();
  }

  /** Replaces the content of a message in the local transcript. */
  @PutMapping("/messages/{messageId}")
  public ResponseEntity<Void> editMessage(
      @PathVariable String messageId, @Valid @RequestBody EditMessageRequest request) {
    conversationEngine.editMessage(messageId, request.getContent());
    return ResponseEntity.noContent().build();
  }

  /** Gets the engine state. */
  @GetMapping("/state")
  public ResponseEntity<EngineStateResponse> getState() {
    return ResponseEntity.ok(EngineStateResponse.from(conversationEngine));
  }

  @PutMapping("/provider")
  public ResponseEntity<EngineStateResponse> setProvider(
      @Valid @RequestBody UpdateProviderRequest request) {
    conversationEngine.setProvider(request.getProviderId());
    return ResponseEntity.ok(EngineStateResponse.from(conversationEngine));
  }

  @PutMapping("/model")
  public ResponseEntity<EngineStateResponse> setModel(
      @Valid @RequestBody UpdateModelRequest request) {
    conversationEngine.setModel(request.getModel());
    return ResponseEntity.ok(EngineStateResponse.from(conversationEngine));
  }

  /** Sets the system prompt; a changed prompt starts a new session on the next send. */
  @PutMapping("/system-prompt")
  public ResponseEntity<EngineStateResponse> setSystemPrompt(
      @RequestBody UpdateSystemPromptRequest request) {
    log.info("System prompt update requested");
    conversationEngine.setSystemPrompt(request.getSystemPrompt());
    return ResponseEntity.ok(EngineStateResponse.from(conversationEngine));
  }
}

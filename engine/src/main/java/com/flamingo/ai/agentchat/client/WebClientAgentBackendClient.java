package com.flamingo.ai.agentchat.client;

import com.flamingo.ai.agentchat.channel.EventChannelRegistry;
import com.flamingo.ai.agentchat.client.dto.AgentHistoryMessage;
import com.flamingo.ai.agentchat.client.dto.CreateSessionRequest;
import com.flamingo.ai.agentchat.client.dto.CreateSessionResponse;
import com.flamingo.ai.agentchat.client.dto.ProcessStatus;
import com.flamingo.ai.agentchat.client.dto.SendMessageRequest;
import com.flamingo.ai.agentchat.client.dto.SessionInfo;
import com.flamingo.ai.agentchat.config.AgentChatConfig;
import com.flamingo.ai.agentchat.exception.AgentBackendException;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the agent process. Encapsulates all WebClient communication; streamed events are
 * forwarded verbatim onto the {@link EventChannelRegistry} channel named in the request.
 */
@Component
@Slf4j
public class WebClientAgentBackendClient implements AgentBackendClient {

  private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final EventChannelRegistry channelRegistry;
  private final Duration responseTimeout;

  @Autowired
  public WebClientAgentBackendClient(AgentChatConfig config, EventChannelRegistry channelRegistry) {
    AgentChatConfig.Backend backend = config.getBackend();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, backend.getConnectTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(backend.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(backend.getMaxInMemorySize()))
            .build();
    this.channelRegistry = channelRegistry;
    this.responseTimeout = Duration.ofMillis(backend.getResponseTimeoutMs());
    log.info("Agent backend client initialized: baseUrl={}", backend.getBaseUrl());
  }

  WebClientAgentBackendClient(
      WebClient webClient, EventChannelRegistry channelRegistry, Duration responseTimeout) {
    this.webClient = webClient;
    this.channelRegistry = channelRegistry;
    this.responseTimeout = responseTimeout;
  }

  @Override
  public ProcessStatus startProcess() {
    return call(
        "start agent process",
        webClient
            .post()
            .uri("/api/agent/process/start")
            .retrieve()
            .bodyToMono(ProcessStatus.class));
  }

  @Override
  public ProcessStatus stopProcess() {
    return call(
        "stop agent process",
        webClient
            .post()
            .uri("/api/agent/process/stop")
            .retrieve()
            .bodyToMono(ProcessStatus.class));
  }

  @Override
  public ProcessStatus getProcessStatus() {
    return call(
        "get agent process status",
        webClient
            .get()
            .uri("/api/agent/process/status")
            .retrieve()
            .bodyToMono(ProcessStatus.class));
  }

  @Override
  public String createSession(CreateSessionRequest request) {
    CreateSessionResponse response =
        call(
            "create session",
            webClient
                .post()
                .uri("/api/agent/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(CreateSessionResponse.class));
    if (response == null || response.sessionId() == null || response.sessionId().isBlank()) {
      throw new AgentBackendException("Agent returned no session id");
    }
    return response.sessionId();
  }

  @Override
  public List<SessionInfo> listSessions() {
    List<SessionInfo> sessions =
        call(
            "list sessions",
            webClient
                .get()
                .uri("/api/agent/sessions")
                .retrieve()
                .bodyToFlux(SessionInfo.class)
                .collectList());
    return sessions != null ? sessions : List.of();
  }

  @Override
  public List<AgentHistoryMessage> getSessionMessages(String sessionId) {
    List<AgentHistoryMessage> messages =
        call(
            "get messages of session " + sessionId,
            webClient
                .get()
                .uri("/api/agent/sessions/{sessionId}/messages", sessionId)
                .retrieve()
                .bodyToFlux(AgentHistoryMessage.class)
                .collectList());
    return messages != null ? messages : List.of();
  }

  @Override
  public void deleteSession(String sessionId) {
    call(
        "delete session " + sessionId,
        webClient
            .delete()
            .uri("/api/agent/sessions/{sessionId}", sessionId)
            .retrieve()
            .toBodilessEntity());
  }

  @Override
  public Mono<Void> sendMessageStream(SendMessageRequest request) {
    String channelName = request.getEventName();
    return webClient
        .post()
        .uri("/api/agent/chat/stream")
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(SSE_TYPE)
        .doOnNext(
            event -> {
              if (event.data() == null) {
                log.trace("Skipping SSE frame without data on {}", channelName);
                return;
              }
              channelRegistry.publish(channelName, event.data());
            })
        .then()
        .doOnSuccess(ignored -> log.debug("Agent closed stream {}", channelName))
        .onErrorMap(
            e -> !(e instanceof AgentBackendException),
            e -> new AgentBackendException("Streaming request " + channelName + " failed", e));
  }

  private <T> T call(String operation, Mono<T> request) {
    try {
      return request.timeout(responseTimeout).block();
    } catch (RuntimeException e) {
      log.warn("Agent call failed ({}): {}", operation, e.getMessage());
      throw new AgentBackendException("Failed to " + operation, e);
    }
  }
}

package com.flamingo.ai.agentchat.api.dto.response;

import com.flamingo.ai.agentchat.domain.event.FileWriteProposedEvent;
import com.flamingo.ai.agentchat.domain.event.NotificationEvent;
import com.flamingo.ai.agentchat.domain.event.TranscriptUpdatedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for events pushed to the display layer over SSE. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineEventResponse {

  /** Event type: transcript, notification, file_write. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates a transcript event carrying the whole transcript. */
  public static EngineEventResponse transcript(TranscriptUpdatedEvent event) {
    return EngineEventResponse.builder().eventType("transcript").data(event).build();
  }

  /** Creates a notification event. */
  public static EngineEventResponse notification(NotificationEvent event) {
    return EngineEventResponse.builder().eventType("notification").data(event).build();
  }

  /** Creates a file write preview event. */
  public static EngineEventResponse fileWrite(FileWriteProposedEvent event) {
    return EngineEventResponse.builder().eventType("file_write").data(event).build();
  }
}

package com.aegis.aegis_intel_api.dto.analyst;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything derived from one scan: the context sent to the analyst, the SITREP and the
 * follow-up conversation.
 */
public record ScanArtifact(
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime timestamp,
        @JsonProperty("detection_context") String detectionContext,
        String sitrep,
        String model,
        int tokens,
        @JsonProperty("chat_history") List<ChatTurn> chatHistory
) {

    public ScanArtifact {
        chatHistory = chatHistory == null ? List.of() : List.copyOf(chatHistory);
    }

    public ScanArtifact withChatTurns(List<ChatTurn> turns) {
        List<ChatTurn> history = new ArrayList<>(chatHistory);
        history.addAll(turns);
        return new ScanArtifact(timestamp, detectionContext, sitrep, model, tokens, history);
    }
}

package com.aegis.aegis_intel_api.repository;

import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.ScanArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of scan artifacts. Artifacts are created once, then only extended with chat turns.
 */
public interface ScanArtifactStore {

    /**
     * @return false if an artifact already exists for {@code scanId}; it is left untouched
     */
    boolean create(String scanId, String detectionContext, String sitrep, String model, int tokens);

    Optional<ScanArtifact> get(String scanId);

    /**
     * Appends turns in order, in a single update. Unknown scan ids are ignored with a warning.
     *
     * @return whether the scan exists
     */
    boolean appendChatTurns(String scanId, List<ChatTurn> turns);

    default boolean appendChatTurn(String scanId, String role, String content) {
        return appendChatTurns(scanId, List.of(new ChatTurn(role, content)));
    }

    List<ChatTurn> chatHistory(String scanId);

    /**
     * Keeps the {@code keep} most recently created artifacts.
     *
     * @return number of artifacts evicted
     */
    int retainMostRecent(int keep);
}

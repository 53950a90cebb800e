package org.example.storyprep.service.chunking;

import java.util.List;

public record ChunkingResult(
        List<ChunkDraft> chunks,
        String strategy,
        int totalNarrativeWords,
        List<String> failedStrategies
) {

    public ChunkingResult {
        chunks = List.copyOf(chunks);
        failedStrategies = failedStrategies == null ? List.of() : List.copyOf(failedStrategies);
    }

    public int totalChunks() {
        return chunks.size();
    }
}

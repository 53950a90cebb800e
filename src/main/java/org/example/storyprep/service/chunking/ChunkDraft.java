package org.example.storyprep.service.chunking;

/**
 * One finished chunk before persistence. {@code text} includes the recap header for chunks after the first.
 */
public record ChunkDraft(
        int chunkNumber,
        int totalChunks,
        String text,
        int wordCount,
        int narrativeWordCount,
        boolean hasRecap
) {
}

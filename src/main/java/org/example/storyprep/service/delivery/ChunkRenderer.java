package org.example.storyprep.service.delivery;

import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;

/**
 * Turns a stored chunk into the file that is mailed to the reading device.
 */
public interface ChunkRenderer {

    DeliveryArtifact render(StoryEntity story, StoryChunkEntity chunk);

    String fileName(String title, int chunkNumber, int totalChunks);

    static String subject(String title, int chunkNumber, int totalChunks) {
        return title + " - Part " + chunkNumber + "/" + totalChunks;
    }
}

package org.example.storyprep.service.delivery;

public class ChunkNotFoundException extends RuntimeException {

    public ChunkNotFoundException(String chunkId) {
        super("Chunk not found: " + chunkId);
    }
}

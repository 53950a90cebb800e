package org.example.storyprep.service.chunking;

/**
 * A model-backed chunker could not produce usable breaks. Always absorbed by falling back.
 */
public class ChunkingException extends Exception {

    public ChunkingException(String message) {
        super(message);
    }

    public ChunkingException(String message, Throwable cause) {
        super(message, cause);
    }
}

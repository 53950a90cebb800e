package org.example.storyprep.service.delivery;

/**
 * The outbound transport could not hand the chunk over. The chunk stays unsent.
 */
public class DeliveryException extends Exception {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

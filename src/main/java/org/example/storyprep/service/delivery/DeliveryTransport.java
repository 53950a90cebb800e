package org.example.storyprep.service.delivery;

public interface DeliveryTransport {

    void send(String recipient, DeliveryArtifact artifact, String bodyText) throws DeliveryException;
}

package org.example.storyprep.service.delivery;

public record DeliveryArtifact(
        String fileName,
        String contentType,
        byte[] content,
        String subject
) {

    public DeliveryArtifact withSubject(String newSubject) {
        return new DeliveryArtifact(fileName, contentType, content, newSubject);
    }
}

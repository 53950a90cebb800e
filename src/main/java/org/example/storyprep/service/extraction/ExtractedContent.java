package org.example.storyprep.service.extraction;

public record ExtractedContent(
        String text,
        String title,
        String author,
        String extractionMethod,
        int wordCount,
        ExtractionConfidence confidence
) {

    public ExtractedContent withExtractionMethod(String method) {
        return new ExtractedContent(text, title, author, method, wordCount, confidence);
    }

    public ExtractedContent withConfidence(ExtractionConfidence newConfidence) {
        return new ExtractedContent(text, title, author, extractionMethod, wordCount, newConfidence);
    }
}

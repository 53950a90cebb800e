package org.example.storyprep.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDateTime;

@Entity
@Table(name = "story_chunks",
        uniqueConstraints = @UniqueConstraint(name = "uk_story_chunk_number", columnNames = {"story_id", "chunk_number"}),
        indexes = @Index(name = "idx_story_chunks_unsent", columnList = "sent_at, created_at"))
public class StoryChunkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "story_id", nullable = false)
    private StoryEntity story;

    @Column(name = "chunk_number", nullable = false)
    private int chunkNumber;

    @Column(nullable = false)
    private int totalChunks;

    @Column(nullable = false)
    private int wordCount;

    @Column(nullable = false)
    private int narrativeWordCount;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(length = 500)
    private String storagePath;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(length = 120)
    private String deliveryClaimOwner;

    private LocalDateTime deliveryClaimExpiresAt;

    public StoryChunkEntity() {
    }

    public StoryChunkEntity(StoryEntity story, int chunkNumber, int totalChunks, String text) {
        this.story = story;
        this.chunkNumber = chunkNumber;
        this.totalChunks = totalChunks;
        this.text = text;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public StoryEntity getStory() {
        return story;
    }

    public void setStory(StoryEntity story) {
        this.story = story;
    }

    public int getChunkNumber() {
        return chunkNumber;
    }

    public void setChunkNumber(int chunkNumber) {
        this.chunkNumber = chunkNumber;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    public void setTotalChunks(int totalChunks) {
        this.totalChunks = totalChunks;
    }

    public int getWordCount() {
        return wordCount;
    }

    public void setWordCount(int wordCount) {
        this.wordCount = wordCount;
    }

    public int getNarrativeWordCount() {
        return narrativeWordCount;
    }

    public void setNarrativeWordCount(int narrativeWordCount) {
        this.narrativeWordCount = narrativeWordCount;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getSentAt() {
        return sentAt;
    }

    public void setSentAt(LocalDateTime sentAt) {
        this.sentAt = sentAt;
    }

    public String getDeliveryClaimOwner() {
        return deliveryClaimOwner;
    }

    public void setDeliveryClaimOwner(String deliveryClaimOwner) {
        this.deliveryClaimOwner = deliveryClaimOwner;
    }

    public LocalDateTime getDeliveryClaimExpiresAt() {
        return deliveryClaimExpiresAt;
    }

    public void setDeliveryClaimExpiresAt(LocalDateTime deliveryClaimExpiresAt) {
        this.deliveryClaimExpiresAt = deliveryClaimExpiresAt;
    }
}

package org.example.storyprep.repository;

import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface StoryChunkRepository extends JpaRepository<StoryChunkEntity, String> {

    List<StoryChunkEntity> findByStoryIdOrderByChunkNumberAsc(String storyId);

    long countByStoryId(String storyId);

    long countByStoryIdAndSentAtIsNotNull(String storyId);

    @Query("SELECT c FROM StoryChunkEntity c JOIN FETCH c.story WHERE c.id = :chunkId")
    Optional<StoryChunkEntity> findByIdWithStory(@Param("chunkId") String chunkId);

    /**
     * Unsent chunks of chunked stories, oldest batch first, in chunk order within a story.
     * A chunk only qualifies once every earlier chunk of its story has been sent, and not
     * while another invocation holds a live delivery claim on it.
     */
    @Query("""
            SELECT c
            FROM StoryChunkEntity c
            JOIN FETCH c.story s
            WHERE s.status = :chunkedStatus
              AND c.sentAt IS NULL
              AND (c.deliveryClaimOwner IS NULL OR c.deliveryClaimExpiresAt IS NULL OR c.deliveryClaimExpiresAt < :now)
              AND NOT EXISTS (
                SELECT p.id
                FROM StoryChunkEntity p
                WHERE p.story = c.story
                  AND p.chunkNumber < c.chunkNumber
                  AND p.sentAt IS NULL
              )
            ORDER BY c.createdAt ASC, s.id ASC, c.chunkNumber ASC
            """)
    List<StoryChunkEntity> findDeliveryCandidates(
            @Param("chunkedStatus") StoryStatus chunkedStatus,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    @Query("""
            SELECT COUNT(c)
            FROM StoryChunkEntity c
            WHERE c.story.status = :chunkedStatus
              AND c.sentAt IS NULL
            """)
    long countUnsent(@Param("chunkedStatus") StoryStatus chunkedStatus);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryChunkEntity c
            SET c.deliveryClaimOwner = :claimOwner,
                c.deliveryClaimExpiresAt = :claimExpiresAt
            WHERE c.id = :chunkId
              AND c.sentAt IS NULL
              AND (c.deliveryClaimOwner IS NULL OR c.deliveryClaimExpiresAt IS NULL OR c.deliveryClaimExpiresAt < :now)
            """)
    int claimDelivery(
            @Param("chunkId") String chunkId,
            @Param("claimOwner") String claimOwner,
            @Param("now") LocalDateTime now,
            @Param("claimExpiresAt") LocalDateTime claimExpiresAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryChunkEntity c
            SET c.sentAt = :sentAt,
                c.deliveryClaimOwner = NULL,
                c.deliveryClaimExpiresAt = NULL
            WHERE c.id = :chunkId
              AND c.sentAt IS NULL
              AND c.deliveryClaimOwner = :claimOwner
            """)
    int markSent(
            @Param("chunkId") String chunkId,
            @Param("claimOwner") String claimOwner,
            @Param("sentAt") LocalDateTime sentAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryChunkEntity c
            SET c.deliveryClaimOwner = NULL,
                c.deliveryClaimExpiresAt = NULL
            WHERE c.id = :chunkId
              AND c.deliveryClaimOwner = :claimOwner
            """)
    int releaseClaim(
            @Param("chunkId") String chunkId,
            @Param("claimOwner") String claimOwner);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryChunkEntity c
            SET c.sentAt = NULL,
                c.deliveryClaimOwner = NULL,
                c.deliveryClaimExpiresAt = NULL
            WHERE c.id = :chunkId
            """)
    int resetDelivery(@Param("chunkId") String chunkId);
}

package org.example.storyprep.repository;

import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface StoryRepository extends JpaRepository<StoryEntity, String> {

    Optional<StoryEntity> findBySourceRef(String sourceRef);

    boolean existsBySourceRef(String sourceRef);

    List<StoryEntity> findByStatus(StoryStatus status);

    List<StoryEntity> findByStatusAndRetryCountLessThanOrderByUpdatedAtAsc(StoryStatus status, int retryCount);

    List<StoryEntity> findByStatusAndRetryCountGreaterThanEqualOrderByUpdatedAtDesc(StoryStatus status, int retryCount);

    List<StoryEntity> findTop50ByOrderByReceivedAtDesc();

    long countByStatus(StoryStatus status);

    /**
     * Moves a story into {@code target} only if it is still in one of {@code expected}.
     * Returns 0 when another worker got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryEntity s
            SET s.status = :target,
                s.updatedAt = :now
            WHERE s.id = :storyId
              AND s.status IN :expected
            """)
    int transitionStatus(
            @Param("storyId") String storyId,
            @Param("expected") Collection<StoryStatus> expected,
            @Param("target") StoryStatus target,
            @Param("now") LocalDateTime now);
}

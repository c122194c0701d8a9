package com.example.reelbot_backend.repository;

import com.example.reelbot_backend.model.CompositeClip;
import com.example.reelbot_backend.util.ClipStatus;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CompositeClipRepository extends JpaRepository<CompositeClip, UUID> {

    List<CompositeClip> findByCompositeIdOrderByClipIndexAsc(UUID compositeId);

    Optional<CompositeClip> findByCompositeIdAndClipIndex(UUID compositeId, int clipIndex);

    Optional<CompositeClip> findByProviderHandle(String providerHandle);

    List<CompositeClip> findByStatusInAndProviderHandleIsNotNull(Collection<ClipStatus> statuses);

    @Modifying
    @Transactional
    long deleteByCompositeId(UUID compositeId);

    /**
     * Claims a pending clip for submission and counts the attempt.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO,
               c.attempts = c.attempts + 1,
               c.updatedAt = :now
         where c.id = :id
           and c.status = com.example.reelbot_backend.util.ClipStatus.PENDING
        """)
    int claimForDispatch(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.providerHandle = :handle,
               c.updatedAt = :now
         where c.id = :id
           and c.providerHandle is null
           and c.status in (com.example.reelbot_backend.util.ClipStatus.GENERATING_AUDIO,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO)
        """)
    int bindHandle(@Param("id") UUID id, @Param("handle") String handle, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO,
               c.updatedAt = :now
         where c.id = :id
           and c.status in (com.example.reelbot_backend.util.ClipStatus.PENDING,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_AUDIO)
        """)
    int markGeneratingVideo(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.COMPLETED,
               c.videoUrl = :videoUrl,
               c.duration = :duration,
               c.errorMessage = null,
               c.updatedAt = :now,
               c.completedAt = :now
         where c.id = :id
           and c.status in (com.example.reelbot_backend.util.ClipStatus.PENDING,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_AUDIO,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO)
        """)
    int markCompleted(@Param("id") UUID id,
                      @Param("videoUrl") String videoUrl,
                      @Param("duration") Double duration,
                      @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.FAILED,
               c.errorMessage = :error,
               c.updatedAt = :now,
               c.completedAt = :now
         where c.id = :id
           and c.status in (com.example.reelbot_backend.util.ClipStatus.PENDING,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_AUDIO,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO)
        """)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

    /**
     * Sends an in-flight clip back to PENDING after a retryable failure, dropping its handle so the
     * dispatcher can bind a fresh one.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.PENDING,
               c.providerHandle = null,
               c.errorMessage = :error,
               c.updatedAt = :now
         where c.id = :id
           and c.status in (com.example.reelbot_backend.util.ClipStatus.GENERATING_AUDIO,
                            com.example.reelbot_backend.util.ClipStatus.GENERATING_VIDEO)
        """)
    int requeue(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

    /**
     * Operator retry of a failed clip with a fresh attempt budget.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeClip c
           set c.status = com.example.reelbot_backend.util.ClipStatus.PENDING,
               c.providerHandle = null,
               c.errorMessage = null,
               c.attempts = 0,
               c.completedAt = null,
               c.updatedAt = :now
         where c.id = :id
           and c.status = com.example.reelbot_backend.util.ClipStatus.FAILED
        """)
    int resetFailed(@Param("id") UUID id, @Param("now") Instant now);
}

package com.example.reelbot_backend.repository;

import com.example.reelbot_backend.model.CompositeVideo;
import com.example.reelbot_backend.util.CompositeStatus;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Status changes go through conditional updates; a return value of {@code 0} means another writer
 * got there first or the composite is no longer in the expected state.
 */
public interface CompositeVideoRepository extends JpaRepository<CompositeVideo, UUID> {

    Optional<CompositeVideo> findByStitchHandle(String stitchHandle);

    List<CompositeVideo> findByStatus(CompositeStatus status);

    List<CompositeVideo> findByStatusAndStitchHandleIsNull(CompositeStatus status);

    List<CompositeVideo> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeVideo v
           set v.status = com.example.reelbot_backend.util.CompositeStatus.GENERATING_CLIPS,
               v.updatedAt = :now,
               v.version = v.version + 1
         where v.id = :id
           and v.status = com.example.reelbot_backend.util.CompositeStatus.PENDING
        """)
    int markGeneratingClips(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Moves the composite to STITCHING only while it is generating clips and every clip row is
     * completed. Exactly one concurrent caller observes {@code 1}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeVideo v
           set v.status = com.example.reelbot_backend.util.CompositeStatus.STITCHING,
               v.updatedAt = :now,
               v.version = v.version + 1
         where v.id = :id
           and v.status = com.example.reelbot_backend.util.CompositeStatus.GENERATING_CLIPS
           and v.totalClips = (select count(c) from CompositeClip c
                                where c.compositeId = v.id
                                  and c.status = com.example.reelbot_backend.util.ClipStatus.COMPLETED)
        """)
    int markStitching(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeVideo v
           set v.stitchHandle = :handle,
               v.updatedAt = :now
         where v.id = :id
           and v.status = com.example.reelbot_backend.util.CompositeStatus.STITCHING
           and v.stitchHandle is null
        """)
    int bindStitchHandle(@Param("id") UUID id, @Param("handle") String handle, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeVideo v
           set v.status = com.example.reelbot_backend.util.CompositeStatus.COMPLETED,
               v.finalVideoUrl = :videoUrl,
               v.thumbnailUrl = :thumbnailUrl,
               v.actualDuration = :duration,
               v.errorMessage = null,
               v.updatedAt = :now,
               v.completedAt = :now,
               v.version = v.version + 1
         where v.id = :id
           and v.status = com.example.reelbot_backend.util.CompositeStatus.STITCHING
        """)
    int markCompleted(@Param("id") UUID id,
                      @Param("videoUrl") String videoUrl,
                      @Param("thumbnailUrl") String thumbnailUrl,
                      @Param("duration") Double duration,
                      @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        update CompositeVideo v
           set v.status = com.example.reelbot_backend.util.CompositeStatus.FAILED,
               v.errorMessage = :error,
               v.updatedAt = :now,
               v.completedAt = :now,
               v.version = v.version + 1
         where v.id = :id
           and v.status in (com.example.reelbot_backend.util.CompositeStatus.PENDING,
                            com.example.reelbot_backend.util.CompositeStatus.GENERATING_CLIPS,
                            com.example.reelbot_backend.util.CompositeStatus.STITCHING)
        """)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);
}

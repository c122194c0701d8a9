package com.example.reelbot_backend.model;

import com.example.reelbot_backend.util.AspectRatio;
import com.example.reelbot_backend.util.CompositeStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a multi-clip video. The number of finished clips is never stored here; it is
 * always counted from {@link CompositeClip} rows.
 */
@Entity
@Table(
        name = "composite_video",
        indexes = {
                @Index(name = "idx_composite_status_created", columnList = "status, created_at"),
                @Index(name = "idx_composite_owner", columnList = "owner_id")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_composite_stitch_handle", columnNames = "stitch_handle")
)
public class CompositeVideo {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "review_id", nullable = false)
    private String reviewId;

    @Column(name = "actor_id", nullable = false, length = 64)
    private String actorId;

    @Column(name = "voice_id", nullable = false, length = 32)
    private String voiceId;

    @Column(name = "full_script", nullable = false, columnDefinition = "text")
    private String fullScript;

    @Enumerated(EnumType.STRING)
    @Column(name = "aspect_ratio", nullable = false, length = 32)
    private AspectRatio aspectRatio = AspectRatio.PORTRAIT;

    @Column(name = "target_duration", nullable = false)
    private int targetDuration;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private CompositeStatus status = CompositeStatus.PENDING;

    @Column(name = "total_clips", nullable = false)
    private int totalClips;

    @Column(name = "stitch_handle")
    private String stitchHandle;

    @Column(name = "final_video_url", columnDefinition = "text")
    private String finalVideoUrl;

    @Column(name = "thumbnail_url", columnDefinition = "text")
    private String thumbnailUrl;

    @Column(name = "actual_duration")
    private Double actualDuration;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected CompositeVideo() {}

    public CompositeVideo(String ownerId, String reviewId, String actorId, String voiceId, String fullScript,
                          AspectRatio aspectRatio, int targetDuration, int totalClips) {
        this.ownerId = ownerId;
        this.reviewId = reviewId;
        this.actorId = actorId;
        this.voiceId = voiceId;
        this.fullScript = fullScript;
        this.aspectRatio = aspectRatio;
        this.targetDuration = targetDuration;
        this.totalClips = totalClips;
    }

    public UUID getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getReviewId() {
        return reviewId;
    }

    public String getActorId() {
        return actorId;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public String getFullScript() {
        return fullScript;
    }

    public AspectRatio getAspectRatio() {
        return aspectRatio;
    }

    public int getTargetDuration() {
        return targetDuration;
    }

    public CompositeStatus getStatus() {
        return status;
    }

    public void setStatus(CompositeStatus status) {
        this.status = status;
    }

    public int getTotalClips() {
        return totalClips;
    }

    public String getStitchHandle() {
        return stitchHandle;
    }

    public String getFinalVideoUrl() {
        return finalVideoUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public Double getActualDuration() {
        return actualDuration;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = CompositeStatus.PENDING;
    }
}

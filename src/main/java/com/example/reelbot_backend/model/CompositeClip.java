package com.example.reelbot_backend.model;

import com.example.reelbot_backend.util.ClipStatus;
import com.example.reelbot_backend.util.ClipType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "composite_clip",
        indexes = @Index(name = "idx_clip_composite_status", columnList = "composite_id, status"),
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_clip_composite_index", columnNames = {"composite_id", "clip_index"}),
                @UniqueConstraint(name = "uk_clip_provider_handle", columnNames = "provider_handle")
        }
)
public class CompositeClip {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "composite_id", nullable = false, updatable = false)
    private UUID compositeId;

    // 1-based position inside the final video
    @Column(name = "clip_index", nullable = false)
    private int clipIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "clip_type", nullable = false, length = 32)
    private ClipType clipType;

    @Column(name = "script_content", nullable = false, columnDefinition = "text")
    private String scriptContent;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ClipStatus status = ClipStatus.PENDING;

    @Column(name = "provider_handle")
    private String providerHandle;

    @Column(name = "video_url", columnDefinition = "text")
    private String videoUrl;

    @Column(name = "audio_url", columnDefinition = "text")
    private String audioUrl;

    @Column(name = "duration")
    private Double duration;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

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

    protected CompositeClip() {}

    public CompositeClip(UUID compositeId, int clipIndex, ClipType clipType, String scriptContent) {
        this.compositeId = compositeId;
        this.clipIndex = clipIndex;
        this.clipType = clipType;
        this.scriptContent = scriptContent;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCompositeId() {
        return compositeId;
    }

    public int getClipIndex() {
        return clipIndex;
    }

    public ClipType getClipType() {
        return clipType;
    }

    public String getScriptContent() {
        return scriptContent;
    }

    public ClipStatus getStatus() {
        return status;
    }

    public void setStatus(ClipStatus status) {
        this.status = status;
    }

    public String getProviderHandle() {
        return providerHandle;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public String getAudioUrl() {
        return audioUrl;
    }

    public Double getDuration() {
        return duration;
    }

    public int getAttempts() {
        return attempts;
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

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = ClipStatus.PENDING;
    }
}

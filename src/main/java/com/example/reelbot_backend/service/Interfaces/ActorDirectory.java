package com.example.reelbot_backend.service.Interfaces;

import java.util.Optional;

/**
 * Lookup of on-screen actors (avatars) available for composite videos.
 */
public interface ActorDirectory {
    record Actor(String id, String name, String referenceImageUrl, String defaultVoiceId, boolean active) {}

    Optional<Actor> findActive(String actorId);
}

package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.ActorProperties;
import com.example.reelbot_backend.service.Interfaces.ActorDirectory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class PropertiesActorDirectory implements ActorDirectory {
    private final ActorProperties props;

    public PropertiesActorDirectory(ActorProperties props) {
        this.props = props;
    }

    @Override
    public Optional<Actor> findActive(String actorId) {
        if (actorId == null) {
            return Optional.empty();
        }
        ActorProperties.Actor a = props.getCatalog().get(actorId);
        if (a == null || !a.isActive()) {
            return Optional.empty();
        }
        return Optional.of(new Actor(actorId, a.getName(), a.getReferenceImageUrl(), a.getVoiceId(), true));
    }
}

package com.example.reelbot_backend.dto.webhook;

public record WebhookAck(boolean received, String outcome) {}

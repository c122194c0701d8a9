package com.example.reelbot_backend.service.queue;

import com.example.reelbot_backend.util.JobPriority;
import com.example.reelbot_backend.util.JobStatus;

import java.util.Map;

public record QueueStats(int total, Map<JobStatus, Long> byStatus, Map<JobPriority, Long> byPriority) {
}

package com.example.fbp.dto;

import java.time.LocalDateTime;

public record RunStatistics(
        LocalDateTime startTime,
        LocalDateTime endTime,
        double elapsedSeconds,
        double cpuPercent,
        double memPercent
) {}

package com.platform.hacontroller.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * One raw load sample from the telemetry feed.
 */
public record MetricSample(
    @NotBlank String nodeId,
    @DecimalMin("0.0") @DecimalMax("100.0") double cpuPercent,
    @DecimalMin("0.0") @DecimalMax("100.0") double memPercent,
    @PositiveOrZero double lagSeconds,
    @NotNull Instant timestamp
) {
}

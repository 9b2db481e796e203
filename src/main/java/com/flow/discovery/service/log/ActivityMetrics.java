package com.flow.discovery.service.log;

/**
 * Per-activity appearance frequency plus the display size a renderer should use.
 */
public record ActivityMetrics(long frequency, double scale, double width, double height) {
}

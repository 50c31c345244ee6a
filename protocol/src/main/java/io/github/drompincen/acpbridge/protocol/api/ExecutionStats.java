package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionStats(
        Long durationMs,
        Long totalTokens,
        Integer toolUseCount,
        Long inputTokens,
        Long outputTokens,
        Long cacheHitTokens
) {
    public static ExecutionStats from(ToolResponseStats stats) {
        if (stats == null) {
            return null;
        }
        ToolResponseStats.Usage usage = stats.usage();
        return new ExecutionStats(
                stats.totalDurationMs(),
                stats.totalTokens(),
                stats.totalToolUseCount(),
                usage != null ? usage.inputTokens() : null,
                usage != null ? usage.outputTokens() : null,
                usage != null ? usage.cacheReadInputTokens() : null);
    }
}

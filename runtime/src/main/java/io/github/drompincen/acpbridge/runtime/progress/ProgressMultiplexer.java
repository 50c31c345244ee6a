package io.github.drompincen.acpbridge.runtime.progress;

import io.github.drompincen.acpbridge.protocol.api.AcpSessionInfo;
import io.github.drompincen.acpbridge.protocol.api.ContentBlock;
import io.github.drompincen.acpbridge.protocol.api.ExecutionStats;
import io.github.drompincen.acpbridge.protocol.api.HistoryMessage;
import io.github.drompincen.acpbridge.protocol.api.PendingToolCall;
import io.github.drompincen.acpbridge.protocol.api.ProgressStep;
import io.github.drompincen.acpbridge.protocol.api.ProgressStep.StepStatus;
import io.github.drompincen.acpbridge.protocol.api.ProgressStep.StepType;
import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import io.github.drompincen.acpbridge.protocol.api.SessionUpdate;
import io.github.drompincen.acpbridge.protocol.api.StreamingContent;
import io.github.drompincen.acpbridge.protocol.api.ToolCallState;
import io.github.drompincen.acpbridge.protocol.api.ToolResponseStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Accumulates one orchestration run's streamed output and emits a full snapshot per
 * notification. Not shared between runs.
 */
public class ProgressMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(ProgressMultiplexer.class);
    private static final int DESCRIPTION_LENGTH = 200;

    private final String uiSessionId;
    private final String conversationId;
    private final Supplier<AcpSessionInfo> sessionInfo;
    private final Consumer<ProgressUpdate> sink;
    private final StringBuilder buffer = new StringBuilder();
    private final List<PendingToolCall> pendingToolCalls = new ArrayList<>();
    private final List<HistoryMessage> history;
    private int stepCounter;

    public ProgressMultiplexer(String uiSessionId, String conversationId, List<HistoryMessage> history,
                               Supplier<AcpSessionInfo> sessionInfo, Consumer<ProgressUpdate> sink) {
        this.uiSessionId = uiSessionId;
        this.conversationId = conversationId;
        this.history = new ArrayList<>(history != null ? history : List.of());
        this.sessionInfo = sessionInfo;
        this.sink = sink;
    }

    public synchronized void thinking(String title) {
        emit(List.of(ProgressStep.of(nextId("acp-thinking"), StepType.THINKING, title, StepStatus.IN_PROGRESS)),
                false, null, null);
    }

    public synchronized void onSessionUpdate(SessionUpdate update) {
        boolean finished = update.finished();
        ToolResponseStats stats = update.toolResponseStats();
        List<ProgressStep> steps = new ArrayList<>();
        for (ContentBlock block : update.content()) {
            if (block.hasText()) {
                buffer.append(block.text());
                steps.add(ProgressStep.of(nextId("acp-text"), StepType.THINKING, "Agent response",
                                finished ? StepStatus.COMPLETED : StepStatus.IN_PROGRESS)
                        .withDescription(truncate(block.text()))
                        .withLlmContent(buffer.toString()));
            } else if (block.isToolUse()) {
                pendingToolCalls.add(new PendingToolCall(block.name(), block.input()));
                ProgressStep step = ProgressStep.of(nextId("acp-tool"), StepType.TOOL_CALL,
                        "Tool: " + block.name(), StepStatus.PENDING);
                if (stats != null) {
                    step = step.withStats(ExecutionStats.from(stats), stats.agentId());
                }
                steps.add(step);
            }
        }
        if (steps.isEmpty() && stats != null) {
            steps.add(ProgressStep.of(nextId("acp-tool-result"), StepType.TOOL_CALL, "Tool completed",
                            StepStatus.COMPLETED)
                    .withStats(ExecutionStats.from(stats), stats.agentId()));
        }
        if (steps.isEmpty()) {
            steps.add(ProgressStep.of(nextId("acp-streaming"), StepType.THINKING, "Agent response",
                            StepStatus.IN_PROGRESS)
                    .withLlmContent(buffer.toString()));
        }
        emit(steps, finished, null, new StreamingContent(buffer.toString(), !finished));
    }

    public synchronized void onToolCalls(List<ToolCallState> calls) {
        List<ProgressStep> steps = new ArrayList<>();
        for (ToolCallState call : calls) {
            steps.add(new ProgressStep("tool-" + call.toolCallId(), StepType.TOOL_CALL, call.title(),
                    call.kind(), toStepStatus(call), call.startTime(), null, null, null));
        }
        if (!steps.isEmpty()) {
            emit(steps, false, null, new StreamingContent(buffer.toString(), true));
        }
    }

    public synchronized void appendHistory(HistoryMessage message) {
        history.add(message);
    }

    public synchronized void complete(boolean success, String finalResponse, String error) {
        ProgressStep step = ProgressStep.of(nextId("acp-complete"), StepType.COMPLETION,
                        success ? "Response complete" : "Request failed",
                        success ? StepStatus.COMPLETED : StepStatus.ERROR)
                .withDescription(error)
                .withLlmContent(finalResponse);
        emit(List.of(step), true, finalResponse,
                new StreamingContent(finalResponse != null ? finalResponse : "", false));
    }

    public synchronized void fail(String error) {
        ProgressStep step = ProgressStep.of(nextId("acp-error"), StepType.COMPLETION, "Error", StepStatus.ERROR)
                .withDescription(error);
        emit(List.of(step), true, null, new StreamingContent(buffer.toString(), false));
    }

    public synchronized String getAccumulatedText() {
        return buffer.toString();
    }

    public synchronized List<PendingToolCall> getPendingToolCalls() {
        return List.copyOf(pendingToolCalls);
    }

    private void emit(List<ProgressStep> steps, boolean complete, String finalContent, StreamingContent streaming) {
        AcpSessionInfo info = null;
        try {
            info = sessionInfo != null ? sessionInfo.get() : null;
        } catch (Exception e) {
            log.debug("Session info unavailable: {}", e.getMessage());
        }
        ProgressUpdate update = new ProgressUpdate(uiSessionId, conversationId, 1, 1, List.copyOf(steps), complete,
                finalContent, streaming, List.copyOf(history), info, System.currentTimeMillis());
        try {
            sink.accept(update);
        } catch (Exception e) {
            log.warn("Failed to emit progress for session {}: {}", uiSessionId, e.getMessage());
        }
    }

    private String nextId(String prefix) {
        return prefix + "-" + System.currentTimeMillis() + "-" + (++stepCounter);
    }

    private static StepStatus toStepStatus(ToolCallState call) {
        switch (call.status()) {
            case IN_PROGRESS: return StepStatus.IN_PROGRESS;
            case COMPLETED: return StepStatus.COMPLETED;
            case FAILED: return StepStatus.ERROR;
            default: return StepStatus.PENDING;
        }
    }

    private static String truncate(String text) {
        return text.length() > DESCRIPTION_LENGTH ? text.substring(0, DESCRIPTION_LENGTH) + "..." : text;
    }
}

package io.github.drompincen.acpbridge.runtime.agent;

import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;
import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;
import io.github.drompincen.acpbridge.persistence.repository.AgentProfileRepository;
import io.github.drompincen.acpbridge.protocol.api.AgentRunResult;
import io.github.drompincen.acpbridge.protocol.api.HistoryMessage;
import io.github.drompincen.acpbridge.protocol.api.LoadSessionResult;
import io.github.drompincen.acpbridge.protocol.api.PromptResult;
import io.github.drompincen.acpbridge.protocol.api.SessionUpdate;
import io.github.drompincen.acpbridge.protocol.api.ToolCallUpdate;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalRouter;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalService;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import io.github.drompincen.acpbridge.runtime.context.ContextInjector;
import io.github.drompincen.acpbridge.runtime.conversation.ConversationHistoryService;
import io.github.drompincen.acpbridge.runtime.progress.ProgressBroadcaster;
import io.github.drompincen.acpbridge.runtime.progress.ProgressMultiplexer;
import io.github.drompincen.acpbridge.runtime.session.AgentSessionStore;
import io.github.drompincen.acpbridge.runtime.session.PersistedSessionRef;
import io.github.drompincen.acpbridge.runtime.tools.ToolCallTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one prompt through an ACP agent session: resolves or resumes the session, injects
 * context on first use, streams progress and records the exchange.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final AgentSessionClient client;
    private final AgentSessionStore sessionStore;
    private final ContextInjector contextInjector;
    private final ToolCallTracker toolCallTracker;
    private final ApprovalRouter approvalRouter;
    private final ApprovalService approvalService;
    private final ProgressBroadcaster broadcaster;
    private final ConversationHistoryService historyService;
    private final AgentProfileRepository profileRepository;
    private final AcpBridgeSettings settings;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    public AgentOrchestrator(AgentSessionClient client,
                             AgentSessionStore sessionStore,
                             ContextInjector contextInjector,
                             ToolCallTracker toolCallTracker,
                             ApprovalRouter approvalRouter,
                             ApprovalService approvalService,
                             ProgressBroadcaster broadcaster,
                             ConversationHistoryService historyService,
                             AgentProfileRepository profileRepository,
                             AcpBridgeSettings settings) {
        this.client = client;
        this.sessionStore = sessionStore;
        this.contextInjector = contextInjector;
        this.toolCallTracker = toolCallTracker;
        this.approvalRouter = approvalRouter;
        this.approvalService = approvalService;
        this.broadcaster = broadcaster;
        this.historyService = historyService;
        this.profileRepository = profileRepository;
        this.settings = settings;
    }

    private record ActiveRun(String agentName, String agentSessionId) {}

    public AgentRunResult processTranscript(String transcript, RunOptions options) {
        String agentName = options.agentName();
        String conversationId = options.conversationId();
        String uiSessionId = options.uiSessionId();
        log.info("Processing transcript with agent {} for conversation {}", agentName, conversationId);

        ProgressMultiplexer progress = new ProgressMultiplexer(uiSessionId, conversationId,
                historyService.loadHistory(conversationId),
                () -> client.getSessionInfo(agentName).orElse(null),
                update -> {
                    broadcaster.publish(update);
                    if (options.onProgress() != null) {
                        options.onProgress().accept(update);
                    }
                });
        progress.appendHistory(HistoryMessage.user(transcript));
        historyService.appendUserMessage(conversationId, transcript);
        progress.thinking("Sending to " + agentName + "...");

        OrchestratorState state = OrchestratorState.RESOLVING_SESSION;
        String agentSessionId = null;
        AgentSessionListener listener = null;
        try {
            AgentProfileDocument profile = findProfile(agentName);
            agentSessionId = resolveSession(options, profile);
            state = transition(state, OrchestratorState.SESSION_READY, conversationId);

            if (uiSessionId != null) {
                approvalRouter.mapAgentSessionToUiSession(agentSessionId, uiSessionId);
                activeRuns.put(uiSessionId, new ActiveRun(agentName, agentSessionId));
            }
            listener = new RunListener(agentSessionId, progress);
            client.addListener(listener);

            String prompt = transcript;
            boolean injectContext = !sessionStore.hasContextInjected(conversationId);
            if (injectContext) {
                state = transition(state, OrchestratorState.INJECTING_CONTEXT, conversationId);
                String prefix = contextInjector.buildPrefix(settings.getCurrentProfileId(), profile);
                if (!prefix.isEmpty()) {
                    prompt = prefix + transcript;
                    log.info("Injected context prefix ({} chars) for conversation {}", prefix.length(), conversationId);
                }
            }

            state = transition(state, OrchestratorState.SENDING_PROMPT, conversationId);
            state = transition(state, OrchestratorState.AWAITING_COMPLETION, conversationId);
            PromptResult result = client.sendPrompt(agentName, agentSessionId, prompt);
            if (result == null) {
                throw new AgentClientException("Agent " + agentName + " returned no prompt result");
            }
            if (injectContext && result.success()) {
                sessionStore.markContextInjected(conversationId);
            }

            state = transition(state, OrchestratorState.RECORDING_HISTORY, conversationId);
            String accumulated = progress.getAccumulatedText();
            String finalResponse = notEmpty(result.response()) ? result.response()
                    : notEmpty(accumulated) ? accumulated : null;
            if (finalResponse != null) {
                progress.appendHistory(HistoryMessage.assistant(finalResponse, progress.getPendingToolCalls()));
                historyService.appendAssistantMessage(conversationId, finalResponse, progress.getPendingToolCalls());
            }
            progress.complete(result.success(), finalResponse, result.error());
            transition(state, OrchestratorState.DONE, conversationId);
            log.info("Completed conversation {} - success: {}, response length: {}", conversationId,
                    result.success(), finalResponse != null ? finalResponse.length() : 0);
            return new AgentRunResult(result.success(), finalResponse, agentSessionId,
                    result.stopReason(), result.error());
        } catch (Exception e) {
            transition(state, OrchestratorState.ERROR, conversationId);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Agent run failed for conversation {}", conversationId, e);
            progress.fail(message);
            return AgentRunResult.failure(message);
        } finally {
            if (listener != null) {
                client.removeListener(listener);
            }
            if (agentSessionId != null) {
                toolCallTracker.clearSession(agentSessionId);
                approvalService.releaseAgentSession(agentSessionId);
            }
            if (uiSessionId != null && agentSessionId != null) {
                activeRuns.remove(uiSessionId, new ActiveRun(agentName, agentSessionId));
            }
        }
    }

    /**
     * Discards the conversation's agent binding; the next run creates a fresh session.
     */
    public void startNewSession(String conversationId) {
        sessionStore.getPersisted(conversationId).ifPresent(ref -> {
            approvalRouter.clearMapping(ref.sessionId());
            toolCallTracker.clearSession(ref.sessionId());
            approvalService.releaseAgentSession(ref.sessionId());
        });
        sessionStore.clear(conversationId);
        log.info("Cleared agent session for conversation {}", conversationId);
    }

    /**
     * Emergency stop for a UI session. The persisted binding is kept so the session stays resumable.
     *
     * @return true when a run or a routed agent session was found
     */
    public boolean stop(String uiSessionId) {
        ActiveRun run = activeRuns.remove(uiSessionId);
        if (run != null) {
            try {
                client.cancel(run.agentName(), run.agentSessionId());
            } catch (Exception e) {
                log.warn("Cancel failed for agent session {}: {}", run.agentSessionId(), e.getMessage());
            }
        }
        approvalService.denyPending(uiSessionId);
        List<String> agentSessions = approvalRouter.clearMappingsForUiSession(uiSessionId);
        agentSessions.forEach(toolCallTracker::clearSession);
        agentSessions.forEach(approvalService::releaseAgentSession);
        if (run != null) {
            toolCallTracker.clearSession(run.agentSessionId());
            approvalService.releaseAgentSession(run.agentSessionId());
        }
        log.info("Stopped UI session {} ({} agent sessions released)", uiSessionId, agentSessions.size());
        return run != null || !agentSessions.isEmpty();
    }

    /**
     * Binds a conversation to an agent session that already exists on the agent side.
     * The agent holds the history, so context counts as injected.
     */
    public LoadSessionResult resumeSession(String conversationId, String agentName, String agentSessionId, String cwd) {
        LoadSessionResult result = loadQuietly(agentName, agentSessionId, cwd);
        if (!result.success()) {
            return result;
        }
        String sessionId = result.sessionId() != null ? result.sessionId() : agentSessionId;
        sessionStore.getPersisted(conversationId)
                .filter(ref -> !ref.agentName().equals(agentName))
                .ifPresent(ref -> sessionStore.clear(conversationId));
        sessionStore.upsert(conversationId, sessionId, agentName, cwd);
        sessionStore.markContextInjected(conversationId);
        log.info("Resumed agent session {} ({}) for conversation {}", sessionId, agentName, conversationId);
        return LoadSessionResult.loaded(sessionId);
    }

    private String resolveSession(RunOptions options, AgentProfileDocument profile) {
        String conversationId = options.conversationId();
        String agentName = options.agentName();

        if (options.forceNewSession()) {
            sessionStore.clear(conversationId);
            return createSession(conversationId, agentName, workingDirectory(null, profile));
        }

        Optional<AgentSessionDocument> verified = sessionStore.get(conversationId);
        if (verified.isPresent() && agentName.equals(verified.get().getAgentName())) {
            sessionStore.touch(conversationId);
            log.info("Reusing agent session {} for conversation {}", verified.get().getSessionId(), conversationId);
            return verified.get().getSessionId();
        }

        String knownCwd = null;
        Optional<PersistedSessionRef> persisted = sessionStore.getPersisted(conversationId);
        if (persisted.isPresent()) {
            PersistedSessionRef ref = persisted.get();
            if (!agentName.equals(ref.agentName())) {
                log.info("Conversation {} switches from agent {} to {}, dropping old binding",
                        conversationId, ref.agentName(), agentName);
                approvalRouter.clearMapping(ref.sessionId());
                sessionStore.clear(conversationId);
            } else {
                knownCwd = ref.cwd();
                String cwd = workingDirectory(ref.cwd(), profile);
                log.info("Loading persisted agent session {} for conversation {}", ref.sessionId(), conversationId);
                LoadSessionResult loaded = loadQuietly(agentName, ref.sessionId(), cwd);
                if (loaded.success()) {
                    String sessionId = loaded.sessionId() != null ? loaded.sessionId() : ref.sessionId();
                    sessionStore.upsert(conversationId, sessionId, agentName, cwd);
                    sessionStore.markContextInjected(conversationId);
                    return sessionId;
                }
                log.warn("Could not resume agent session {} ({}), creating a new one",
                        ref.sessionId(), loaded.error());
                sessionStore.clear(conversationId);
            }
        }
        return createSession(conversationId, agentName, workingDirectory(knownCwd, profile));
    }

    private String createSession(String conversationId, String agentName, String cwd) {
        String sessionId = client.createSession(agentName, cwd);
        if (sessionId == null || sessionId.isBlank()) {
            throw new AgentClientException("Failed to create session with agent " + agentName);
        }
        sessionStore.upsert(conversationId, sessionId, agentName, cwd);
        log.info("Created agent session {} for conversation {}", sessionId, conversationId);
        return sessionId;
    }

    private LoadSessionResult loadQuietly(String agentName, String sessionId, String cwd) {
        try {
            LoadSessionResult result = client.loadSession(agentName, sessionId, cwd);
            return result != null ? result : LoadSessionResult.failed("No response to session load");
        } catch (Exception e) {
            return LoadSessionResult.failed(e.getMessage());
        }
    }

    private String workingDirectory(String persistedCwd, AgentProfileDocument profile) {
        if (notEmpty(persistedCwd)) return persistedCwd;
        if (profile != null && notEmpty(profile.getWorkingDirectory())) return profile.getWorkingDirectory();
        return settings.getDefaultWorkingDirectory();
    }

    private AgentProfileDocument findProfile(String agentName) {
        try {
            return profileRepository.findByName(agentName).orElse(null);
        } catch (Exception e) {
            log.warn("Could not read agent profile {}: {}", agentName, e.getMessage());
            return null;
        }
    }

    private static OrchestratorState transition(OrchestratorState from, OrchestratorState to, String conversationId) {
        log.debug("Conversation {}: {} -> {}", conversationId, from, to);
        return to;
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    private final class RunListener implements AgentSessionListener {

        private final String agentSessionId;
        private final ProgressMultiplexer progress;

        RunListener(String agentSessionId, ProgressMultiplexer progress) {
            this.agentSessionId = agentSessionId;
            this.progress = progress;
        }

        @Override
        public void onSessionUpdate(SessionUpdate update) {
            if (!agentSessionId.equals(update.sessionId())) return;
            progress.onSessionUpdate(update);
        }

        @Override
        public void onToolCallUpdate(ToolCallUpdate update) {
            if (!agentSessionId.equals(update.sessionId())) return;
            progress.onToolCalls(toolCallTracker.recordToolCallUpdate(agentSessionId, update.toolCall()));
        }
    }
}

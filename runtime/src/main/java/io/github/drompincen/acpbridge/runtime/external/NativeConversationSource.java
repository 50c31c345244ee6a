package io.github.drompincen.acpbridge.runtime.external;

import io.github.drompincen.acpbridge.protocol.external.NativeConversationSummary;

import java.util.List;

/**
 * Conversations recorded by this application, merged into the unified history.
 */
public interface NativeConversationSource {

    List<NativeConversationSummary> listConversations();
}

package io.github.drompincen.acpbridge.runtime.agent.approval;

import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;

public interface ApprovalListener {

    void onApprovalRequest(ApprovalRequestDto request);

    default void onApprovalResolved(ApprovalRequestDto request) {
    }
}

package io.github.drompincen.acpbridge.protocol.api;

public record ApprovalResponseRequest(ApprovalRequestDto.ApprovalStatus status) {}

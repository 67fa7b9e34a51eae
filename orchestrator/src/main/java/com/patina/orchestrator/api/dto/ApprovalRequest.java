package com.patina.orchestrator.api.dto;

/** Request body for POST /runs/{id}/approvals/{nodeId}. */
public record ApprovalRequest(boolean approved) {}

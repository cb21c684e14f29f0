package com.trainrelay.promotion;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record PromotionRequest(
        String requestId,
        String runId,
        String sourceEnvironment,
        String modelName,
        int version,
        String unitId,
        String lineageHash,
        ApprovalState approvalState,
        PropagationState propagationState,
        Instant openedAt,
        Instant deadline,
        Integer sharedVersion,
        String detail,
        Instant updatedAt) {
    public PromotionRequest {
        Objects.requireNonNull(requestId, "requestId");
        approvalState = approvalState == null ? ApprovalState.PENDING : approvalState;
        propagationState = propagationState == null ? PropagationState.NOT_STARTED : propagationState;
        detail = detail == null ? "" : detail;
    }

    public static String requestIdFor(String unitId, String modelName, int version) {
        return unitId + ":" + modelName + ":" + version;
    }

    public PromotionRequest withApproval(ApprovalState state, String note, Instant at) {
        return new PromotionRequest(requestId, runId, sourceEnvironment, modelName, version, unitId, lineageHash,
                state, propagationState, openedAt, deadline, sharedVersion, note, at);
    }

    public PromotionRequest withPropagation(PropagationState state, Integer copiedVersion, String note, Instant at) {
        return new PromotionRequest(requestId, runId, sourceEnvironment, modelName, version, unitId, lineageHash,
                approvalState, state, openedAt, deadline, copiedVersion, note, at);
    }

    @JsonIgnore
    public boolean isResolved() {
        if (approvalState == ApprovalState.REJECTED || approvalState == ApprovalState.TIMED_OUT) {
            return true;
        }
        return approvalState == ApprovalState.APPROVED
                && (propagationState == PropagationState.CONFIRMED || propagationState == PropagationState.TIMED_OUT);
    }

    @JsonIgnore
    public String artifactReference() {
        return modelName + ":v" + version;
    }
}

package com.trainrelay.approval;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ApprovalRecord(ApprovalRequest request, ApprovalDecision decision, String decidedBy, Instant decidedAt) {
    public static ApprovalRecord pending(ApprovalRequest request) {
        return new ApprovalRecord(request, null, null, null);
    }

    @JsonIgnore
    public boolean isDecided() {
        return decision != null;
    }

    public ApprovalRecord decide(ApprovalDecision outcome, String actor, Instant at) {
        return new ApprovalRecord(request, outcome, actor, at);
    }
}

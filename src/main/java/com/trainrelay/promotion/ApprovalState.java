package com.trainrelay.promotion;

import com.trainrelay.approval.ApprovalDecision;

public enum ApprovalState {
    PENDING,
    APPROVED,
    REJECTED,
    TIMED_OUT;

    public static ApprovalState from(ApprovalDecision decision) {
        return switch (decision) {
            case APPROVED -> APPROVED;
            case REJECTED -> REJECTED;
            case TIMED_OUT -> TIMED_OUT;
        };
    }
}

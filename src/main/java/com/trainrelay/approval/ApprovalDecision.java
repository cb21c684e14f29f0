package com.trainrelay.approval;

public enum ApprovalDecision {
    APPROVED,
    REJECTED,
    TIMED_OUT
}

package com.trainrelay.approval;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record ApprovalRequest(
        String requestId,
        String subject,
        Map<String, String> summary,
        Instant openedAt,
        Instant deadline) {
    public ApprovalRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(openedAt, "openedAt");
        Objects.requireNonNull(deadline, "deadline");
        subject = subject == null ? "" : subject;
        summary = summary == null ? Map.of() : Map.copyOf(summary);
    }
}

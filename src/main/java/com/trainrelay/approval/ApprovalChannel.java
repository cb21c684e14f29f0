package com.trainrelay.approval;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface ApprovalChannel {
    CompletableFuture<ApprovalDecision> open(ApprovalRequest request) throws IOException;

    void decide(String requestId, ApprovalDecision decision, String actor) throws IOException;

    Optional<ApprovalRecord> find(String requestId) throws IOException;

    List<ApprovalRecord> pending() throws IOException;

    default void refresh() throws IOException {
    }
}

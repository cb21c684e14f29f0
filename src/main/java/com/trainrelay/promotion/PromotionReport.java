package com.trainrelay.promotion;

import java.util.List;
import java.util.Map;

public record PromotionReport(List<PromotionRequest> requests, Map<String, String> errors) {
    public PromotionReport {
        requests = requests == null ? List.of() : List.copyOf(requests);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public long confirmed() {
        return count(PropagationState.CONFIRMED);
    }

    public long propagationTimedOut() {
        return count(PropagationState.TIMED_OUT);
    }

    public long rejected() {
        return requests.stream().filter(request -> request.approvalState() == ApprovalState.REJECTED).count();
    }

    public long approvalTimedOut() {
        return requests.stream().filter(request -> request.approvalState() == ApprovalState.TIMED_OUT).count();
    }

    public long pending() {
        return requests.stream().filter(request -> !request.isResolved()).count();
    }

    private long count(PropagationState state) {
        return requests.stream().filter(request -> request.propagationState() == state).count();
    }
}

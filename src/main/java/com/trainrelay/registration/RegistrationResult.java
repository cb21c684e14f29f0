package com.trainrelay.registration;

import java.util.List;
import java.util.Map;

import com.trainrelay.registry.Artifact;

public record RegistrationResult(List<Artifact> registered, Map<String, String> failures) {
    public RegistrationResult {
        registered = registered == null ? List.of() : List.copyOf(registered);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public int attempted() {
        return registered.size() + failures.size();
    }

    public double successFraction() {
        return attempted() == 0 ? 1.0 : (double) registered.size() / attempted();
    }
}

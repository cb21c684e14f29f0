package com.trainrelay.registration;

import java.util.Locale;

public class RegistrationThresholdException extends IllegalStateException {
    private final RegistrationResult result;
    private final double minSuccessFraction;

    public RegistrationThresholdException(RegistrationResult result, double minSuccessFraction) {
        super(String.format(Locale.ROOT, "Registration success %.2f below required minimum %.2f (%d of %d registered); failures=%s",
                result.successFraction(), minSuccessFraction, result.registered().size(), result.attempted(), result.failures()));
        this.result = result;
        this.minSuccessFraction = minSuccessFraction;
    }

    public RegistrationResult result() {
        return result;
    }

    public double minSuccessFraction() {
        return minSuccessFraction;
    }
}

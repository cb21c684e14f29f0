package com.trainrelay.execution;

import java.util.concurrent.Semaphore;

public final class AdmissionControl {
    public static final int DEFAULT_CAPACITY = 5;

    private final int capacity;
    private final Semaphore permits;

    public AdmissionControl(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("admission capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    public void release() {
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return capacity - permits.availablePermits();
    }
}

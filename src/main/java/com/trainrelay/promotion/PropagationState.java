package com.trainrelay.promotion;

public enum PropagationState {
    NOT_STARTED,
    COPYING,
    CONFIRMED,
    TIMED_OUT
}

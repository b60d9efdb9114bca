package com.trafficsentinel.core.model;

public enum SignalState {
    RED,
    YELLOW,
    GREEN
}

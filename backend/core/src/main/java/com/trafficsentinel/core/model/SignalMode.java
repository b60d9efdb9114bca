package com.trafficsentinel.core.model;

public enum SignalMode {
    NORMAL,
    EMERGENCY
}

package com.trafficsentinel.core.model;

public enum EmergencySource {
    AMBULANCE,
    MANUAL_OVERRIDE
}

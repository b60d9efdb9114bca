package com.trafficsentinel.service.config;

import com.trafficsentinel.service.runtime.GreenTimePolicy;

import java.time.Duration;

public record GreenTimeConfig(
        Integer heavyAbove,
        Integer moderateFrom,
        Duration heavy,
        Duration moderate,
        Duration light,
        Duration fixedCycleGreen
) {
    public GreenTimePolicy toPolicy() {
        GreenTimePolicy standard = GreenTimePolicy.standard();
        return new GreenTimePolicy(
                heavyAbove == null ? standard.heavyAbove() : heavyAbove,
                moderateFrom == null ? standard.moderateFrom() : moderateFrom,
                heavy == null ? standard.heavy() : heavy,
                moderate == null ? standard.moderate() : moderate,
                light == null ? standard.light() : light,
                fixedCycleGreen == null ? standard.fixedCycleGreen() : fixedCycleGreen
        );
    }
}

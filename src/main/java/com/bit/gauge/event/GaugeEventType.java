package com.bit.gauge.event;

public enum GaugeEventType {
    DEPOSIT,
    WITHDRAWAL,
    REWARD_PAID
}

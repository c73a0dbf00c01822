package com.bit.gauge.event;

import com.bit.gauge.common.AccountAddress;
import lombok.Value;

import java.math.BigInteger;

/**
 * 对外通知事件（仅供外部观察，引擎内部不消费），在状态提交后发布
 */
@Value
public class GaugeEvent {
    GaugeEventType type;
    long poolId;
    AccountAddress participant;
    BigInteger amount;
    long timestamp;
}

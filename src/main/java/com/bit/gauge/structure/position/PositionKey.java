package com.bit.gauge.structure.position;

import com.bit.gauge.common.AccountAddress;
import lombok.Value;

@Value
public class PositionKey {
    long poolId;
    AccountAddress participant;
}

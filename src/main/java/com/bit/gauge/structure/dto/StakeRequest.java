package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.math.BigInteger;

@Data
public class StakeRequest {
    private AccountAddress participant;
    private long poolId;
    // claim / emergencyWithdraw 时忽略
    private BigInteger amount;
}

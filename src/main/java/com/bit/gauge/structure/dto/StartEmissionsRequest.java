package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.math.BigInteger;

@Data
public class StartEmissionsRequest {
    private AccountAddress caller;
    private BigInteger totalSupply;
}

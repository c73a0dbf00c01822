package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import lombok.Data;

import java.math.BigInteger;

@Data
public class RegisterPoolRequest {
    private AccountAddress caller;
    private AssetId stakedAsset;
    private BigInteger reservedWeight = BigInteger.ZERO;
    private boolean refreshFirst = true;
}

package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

@Data
public class ReleaseWeightRequest {
    private AccountAddress caller;
    private long poolId;
    private boolean refreshFirst = true;
}

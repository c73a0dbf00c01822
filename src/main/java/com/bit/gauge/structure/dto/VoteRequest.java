package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Data
public class VoteRequest {
    private AccountAddress participant;
    private List<Long> poolIds = new ArrayList<>();
    // 与poolIds一一对应，按比例归一化到参与者的治理权力
    private List<BigInteger> weights = new ArrayList<>();
}

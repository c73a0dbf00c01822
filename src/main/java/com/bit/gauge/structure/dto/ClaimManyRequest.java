package com.bit.gauge.structure.dto;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ClaimManyRequest {
    private AccountAddress participant;
    private List<Long> poolIds = new ArrayList<>();
}

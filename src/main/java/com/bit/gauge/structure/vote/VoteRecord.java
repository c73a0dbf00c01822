package com.bit.gauge.structure.vote;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参与者的投票记录，每次投票整体替换（先重置再分配）
 */
@Data
public class VoteRecord {

    private AccountAddress participant;

    /**
     * 按投票顺序记录的池编号，重置时按此列表撤销
     */
    private List<Long> pools = new ArrayList<>();

    /**
     * 池编号 -> 分配的权重
     */
    private Map<Long, BigInteger> allocations = new LinkedHashMap<>();

    /**
     * 已使用权重（各分配之和）
     */
    private BigInteger usedWeight = BigInteger.ZERO;

    public VoteRecord(AccountAddress participant) {
        this.participant = participant;
    }

    public BigInteger allocationOf(long poolId) {
        return allocations.getOrDefault(poolId, BigInteger.ZERO);
    }

    public boolean isEmpty() {
        return pools.isEmpty() && usedWeight.signum() == 0;
    }

    public VoteRecord copy() {
        VoteRecord v = new VoteRecord(participant);
        v.pools = new ArrayList<>(pools);
        v.allocations = new LinkedHashMap<>(allocations);
        v.usedWeight = usedWeight;
        return v;
    }
}

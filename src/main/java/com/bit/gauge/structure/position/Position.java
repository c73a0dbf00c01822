package com.bit.gauge.structure.position;

import com.bit.gauge.common.AccountAddress;
import lombok.Data;

import java.math.BigInteger;

/**
 * 质押头寸（池 × 参与者）
 */
@Data
public class Position {

    private long poolId;

    private AccountAddress participant;

    /**
     * 原始质押数量
     */
    private BigInteger stakedAmount = BigInteger.ZERO;

    /**
     * 派生质押（加成后的有效份额），始终 <= stakedAmount
     */
    private BigInteger derivedStake = BigInteger.ZERO;

    /**
     * 奖励债务：derivedStake * 累加器 / 精度 中已结算的部分
     */
    private BigInteger rewardDebt = BigInteger.ZERO;

    public Position(long poolId, AccountAddress participant) {
        this.poolId = poolId;
        this.participant = participant;
    }

    /**
     * 待领取奖励 = derivedStake * accumulated / scale - rewardDebt
     */
    public BigInteger pending(BigInteger accumulated, BigInteger scale) {
        return derivedStake.multiply(accumulated).divide(scale).subtract(rewardDebt);
    }

    public boolean isEmpty() {
        return stakedAmount.signum() == 0 && derivedStake.signum() == 0 && rewardDebt.signum() == 0;
    }

    public Position copy() {
        Position p = new Position(poolId, participant);
        p.stakedAmount = stakedAmount;
        p.derivedStake = derivedStake;
        p.rewardDebt = rewardDebt;
        return p;
    }
}

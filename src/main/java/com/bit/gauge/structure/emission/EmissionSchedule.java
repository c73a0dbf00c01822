package com.bit.gauge.structure.emission;

import lombok.Data;

import java.math.BigInteger;

/**
 * 排放计划：一次性注入奖励总量，在固定窗口内按恒定速率释放
 */
@Data
public class EmissionSchedule {

    private boolean started;

    private BigInteger totalSupply = BigInteger.ZERO;

    /**
     * 全局排放速率 = totalSupply / 窗口秒数（向下取整）
     */
    private BigInteger totalEmissionRate = BigInteger.ZERO;

    private long startTime;

    private long endTime;

    /**
     * 奖励计算的截止时间：窗口结束后不再产生奖励
     */
    public long rewardHorizon(long now) {
        return started ? Math.min(now, endTime) : now;
    }

    public EmissionSchedule copy() {
        EmissionSchedule e = new EmissionSchedule();
        e.started = started;
        e.totalSupply = totalSupply;
        e.totalEmissionRate = totalEmissionRate;
        e.startTime = startTime;
        e.endTime = endTime;
        return e;
    }
}

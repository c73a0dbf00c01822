package com.bit.gauge.structure.pool;

import com.bit.gauge.common.AssetId;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 奖励池：一种质押资产对应一个池，创建后只追加不删除
 */
@Data
@NoArgsConstructor
public class Pool {

    /**
     * 池编号，从0开始连续分配
     */
    private long poolId;

    /**
     * 该池接受的质押资产
     */
    private AssetId stakedAsset;

    /**
     * 上次刷新累加器的时间（epoch秒）
     */
    private long lastDistributionTime;

    /**
     * 当前分配给该池的排放速率（奖励单位/秒），只由 rebalance 修改
     */
    private BigInteger emissionRate = BigInteger.ZERO;

    /**
     * 每份额累计奖励（定点数，已乘以精度），单调不减
     */
    private BigInteger rewardPerShareAccumulated = BigInteger.ZERO;

    /**
     * 创建时预留的引导权重，不归属任何投票者
     */
    private BigInteger reservedWeight = BigInteger.ZERO;

    /**
     * 预留权重是否已释放
     */
    private boolean reservedReleased;

    /**
     * 所有有效投票之和
     */
    private BigInteger votedWeight = BigInteger.ZERO;

    public Pool(long poolId, AssetId stakedAsset, BigInteger reservedWeight, long createdAt) {
        this.poolId = poolId;
        this.stakedAsset = stakedAsset;
        this.reservedWeight = reservedWeight;
        this.lastDistributionTime = createdAt;
    }

    /**
     * 池权重 = 预留权重 + 投票权重
     */
    public BigInteger getWeight() {
        return reservedWeight.add(votedWeight);
    }

    public Pool copy() {
        Pool p = new Pool();
        p.poolId = poolId;
        p.stakedAsset = stakedAsset;
        p.lastDistributionTime = lastDistributionTime;
        p.emissionRate = emissionRate;
        p.rewardPerShareAccumulated = rewardPerShareAccumulated;
        p.reservedWeight = reservedWeight;
        p.reservedReleased = reservedReleased;
        p.votedWeight = votedWeight;
        return p;
    }
}

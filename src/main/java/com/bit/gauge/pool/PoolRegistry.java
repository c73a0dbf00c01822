package com.bit.gauge.pool;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.structure.pool.Pool;

import java.math.BigInteger;

/**
 * 奖励池注册表（只追加，不删除）
 */
public interface PoolRegistry {

    /**
     * 注册奖励池
     * @param caller 治理者
     * @param stakedAsset 质押资产
     * @param reservedWeight 预留引导权重，计入池权重与总权重，不归属任何投票者
     * @param refreshFirst 是否先刷新全部池
     * @return 新池快照
     */
    Pool registerPool(AccountAddress caller, AssetId stakedAsset, BigInteger reservedWeight, boolean refreshFirst);

    /**
     * 释放预留权重：从池权重与总权重中扣除恰好该数量，只能释放一次
     */
    Pool releaseReservedWeight(AccountAddress caller, long poolId, boolean refreshFirst);

    /**
     * 池快照（读取前先刷新）
     */
    Pool getPool(long poolId);

    int poolCount();

    /**
     * @return 质押资产对应的池编号，未注册时返回null
     */
    Long poolIdOf(AssetId stakedAsset);
}

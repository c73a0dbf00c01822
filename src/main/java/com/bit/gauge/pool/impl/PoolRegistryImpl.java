package com.bit.gauge.pool.impl;

import com.bit.gauge.aop.annotation.PermissionsAnnotation;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.pool.PoolRegistry;
import com.bit.gauge.state.GaugeState;
import com.bit.gauge.state.StateTransaction;
import com.bit.gauge.structure.pool.Pool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Slf4j
@Service
public class PoolRegistryImpl implements PoolRegistry {

    private final GaugeState state;

    public PoolRegistryImpl(GaugeState state) {
        this.state = state;
    }

    @Override
    @PermissionsAnnotation
    public Pool registerPool(AccountAddress caller, AssetId stakedAsset, BigInteger reservedWeight, boolean refreshFirst) {
        BigInteger reserved = reservedWeight == null ? BigInteger.ZERO : reservedWeight;
        if (reserved.signum() < 0) {
            throw new GaugeException(ErrorType.INVALID_AMOUNT, "reservedWeight=" + reserved);
        }
        return state.execute("registerPool", txn -> {
            if (stakedAsset == null || stakedAsset.equals(txn.rewardAsset())) {
                throw new GaugeException(ErrorType.INVALID_POOL_ASSET, "stakedAsset=" + stakedAsset);
            }
            Long existing = txn.findPoolId(stakedAsset);
            if (existing != null) {
                throw new GaugeException(ErrorType.POOL_ALREADY_REGISTERED,
                        "stakedAsset=" + stakedAsset + ", poolId=" + existing);
            }
            if (refreshFirst) {
                txn.refreshAll();
            }
            Pool pool = txn.addPool(stakedAsset, reserved);
            txn.setTotalWeight(txn.totalWeight().add(reserved));
            log.info("注册奖励池 poolId={} stakedAsset={} reservedWeight={} totalWeight={}",
                    pool.getPoolId(), stakedAsset, reserved, txn.totalWeight());
            return pool.copy();
        });
    }

    @Override
    @PermissionsAnnotation
    public Pool releaseReservedWeight(AccountAddress caller, long poolId, boolean refreshFirst) {
        return state.execute("releaseReservedWeight", txn -> {
            Pool pool = txn.pool(poolId);
            BigInteger reserved = pool.getReservedWeight();
            if (pool.isReservedReleased() || reserved.signum() == 0) {
                throw new GaugeException(ErrorType.RESERVED_WEIGHT_RELEASED, "poolId=" + poolId);
            }
            if (refreshFirst) {
                txn.refreshAll();
            }
            pool.setReservedWeight(BigInteger.ZERO);
            pool.setReservedReleased(true);
            txn.setTotalWeight(txn.totalWeight().subtract(reserved));
            log.info("释放预留权重 poolId={} released={} totalWeight={}", poolId, reserved, txn.totalWeight());
            return pool.copy();
        });
    }

    @Override
    public Pool getPool(long poolId) {
        return state.execute("getPool", txn -> txn.pool(poolId).copy());
    }

    @Override
    public int poolCount() {
        return state.execute("poolCount", StateTransaction::poolCount);
    }

    @Override
    public Long poolIdOf(AssetId stakedAsset) {
        return state.execute("poolIdOf", txn -> txn.findPoolId(stakedAsset));
    }
}

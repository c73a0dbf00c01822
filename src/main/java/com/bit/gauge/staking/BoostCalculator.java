package com.bit.gauge.staking;

import com.bit.gauge.state.StateTransaction;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;

import java.math.BigInteger;

/**
 * 派生质押（加成）计算
 * derived = min(staked * 40% + (poolTotal * power / totalPower) * 60%, staked)
 */
public interface BoostCalculator {

    /**
     * 纯计算
     * @param stakedAmount 原始质押
     * @param poolTotalStaked 池质押总量
     * @param power 参与者当前治理权力
     * @param totalPower 治理权力总量，为0时没有加成
     */
    BigInteger derivedStake(BigInteger stakedAmount, BigInteger poolTotalStaked,
                            BigInteger power, BigInteger totalPower);

    /**
     * 实时查询池质押总量与治理权力，重算并写入头寸的派生质押
     * @return 新的派生质押
     */
    BigInteger recomputeDerivedStake(StateTransaction txn, Pool pool, Position position);
}

package com.bit.gauge.reward;

import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * 累加器核心算法：把池的 reward-per-share 推进到当前时间
 *
 * accumulated += (horizon - last) * emissionRate * SCALE / stakedBalance
 *
 * 质押余额为0时累加器不动，但 lastDistributionTime 照常推进，该区间的排放作废，
 * 下一次非零刷新不会把空区间重复计入。
 */
@Slf4j
@Component
public class RewardAccumulator {

    private final BigInteger scale;

    public RewardAccumulator(SystemConfig config) {
        this.scale = config.scale();
    }

    /**
     * 推进单个池的累加器（直接修改传入的工作快照）
     * @param pool 池的工作快照
     * @param emission 排放计划，用于截断窗口结束后的区间
     * @param now 当前时间（epoch秒）
     * @param stakedBalance 池当前质押总量，仅在需要时查询
     * @return 是否有时间推进
     */
    public boolean accrue(Pool pool, EmissionSchedule emission, long now, Supplier<BigInteger> stakedBalance) {
        long last = pool.getLastDistributionTime();
        // 没有时间流逝，跳过
        if (now <= last) {
            return false;
        }
        long elapsed = emission.rewardHorizon(now) - last;
        if (elapsed > 0 && pool.getEmissionRate().signum() > 0) {
            BigInteger supply = stakedBalance.get();
            if (supply.signum() > 0) {
                BigInteger reward = pool.getEmissionRate().multiply(BigInteger.valueOf(elapsed));
                BigInteger delta = reward.multiply(scale).divide(supply);
                pool.setRewardPerShareAccumulated(pool.getRewardPerShareAccumulated().add(delta));
                log.debug("池{}累加器推进: elapsed={}s, reward={}, supply={}, accumulated={}",
                        pool.getPoolId(), elapsed, reward, supply, pool.getRewardPerShareAccumulated());
            } else {
                log.debug("池{}质押余额为0，区间[{}, {}]的排放作废", pool.getPoolId(), last, now);
            }
        }
        pool.setLastDistributionTime(now);
        return true;
    }
}

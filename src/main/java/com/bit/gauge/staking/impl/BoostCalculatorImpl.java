package com.bit.gauge.staking.impl;

import com.bit.gauge.asset.GovernancePowerSource;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.staking.BoostCalculator;
import com.bit.gauge.state.StateTransaction;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Slf4j
@Service
public class BoostCalculatorImpl implements BoostCalculator {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final GovernancePowerSource governancePower;
    private final BigInteger basePercent;
    private final BigInteger boostPercent;

    public BoostCalculatorImpl(GovernancePowerSource governancePower, SystemConfig config) {
        this.governancePower = governancePower;
        this.basePercent = BigInteger.valueOf(config.getBoostBasePercent());
        this.boostPercent = HUNDRED.subtract(basePercent);
    }

    @Override
    public BigInteger derivedStake(BigInteger stakedAmount, BigInteger poolTotalStaked,
                                   BigInteger power, BigInteger totalPower) {
        BigInteger base = stakedAmount.multiply(basePercent).divide(HUNDRED);
        if (totalPower.signum() <= 0) {
            return base;
        }
        BigInteger poolShare = poolTotalStaked.multiply(power).divide(totalPower);
        BigInteger boosted = poolShare.multiply(boostPercent).divide(HUNDRED);
        // 上限为原始质押，治理权力再大也不能超过自身的真实敞口
        return base.add(boosted).min(stakedAmount);
    }

    @Override
    public BigInteger recomputeDerivedStake(StateTransaction txn, Pool pool, Position position) {
        BigInteger poolTotal = txn.stakedBalance(pool);
        BigInteger power = governancePower.powerOf(position.getParticipant());
        BigInteger totalPower = governancePower.totalPower();
        BigInteger derived = derivedStake(position.getStakedAmount(), poolTotal, power, totalPower);
        log.debug("派生质押重算 pool={} participant={} staked={} poolTotal={} power={}/{} -> {}",
                pool.getPoolId(), position.getParticipant(), position.getStakedAmount(),
                poolTotal, power, totalPower, derived);
        position.setDerivedStake(derived);
        return derived;
    }
}

package com.bit.gauge.reward.impl;

import com.bit.gauge.aop.annotation.PermissionsAnnotation;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.reward.AccumulatorEngine;
import com.bit.gauge.state.GaugeState;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Slf4j
@Service
public class AccumulatorEngineImpl implements AccumulatorEngine {

    private final GaugeState state;
    private final long windowSeconds;

    public AccumulatorEngineImpl(GaugeState state, SystemConfig config) {
        this.state = state;
        this.windowSeconds = config.getEmissionWindowSeconds();
    }

    @Override
    public Pool refresh(long poolId) {
        return state.execute("refresh", txn -> txn.pool(poolId).copy());
    }

    @Override
    public void refreshAll() {
        state.run("refreshAll", txn -> {
            int count = txn.refreshAll().size();
            log.debug("已刷新全部{}个池", count);
        });
    }

    @Override
    @PermissionsAnnotation
    public EmissionSchedule startEmissions(AccountAddress caller, BigInteger totalSupply) {
        if (totalSupply == null || totalSupply.signum() <= 0) {
            throw new GaugeException(ErrorType.INVALID_AMOUNT, "totalSupply=" + totalSupply);
        }
        return state.execute("startEmissions", txn -> {
            EmissionSchedule emission = txn.emission();
            if (emission.isStarted()) {
                throw new GaugeException(ErrorType.EMISSIONS_ALREADY_STARTED,
                        "已于" + emission.getStartTime() + "启动");
            }
            // 先拉入奖励，失败则整个操作失败
            txn.transfer(txn.rewardAsset(), caller, txn.custody(), totalSupply);

            emission.setStarted(true);
            emission.setTotalSupply(totalSupply);
            emission.setTotalEmissionRate(totalSupply.divide(BigInteger.valueOf(windowSeconds)));
            emission.setStartTime(txn.now());
            emission.setEndTime(txn.now() + windowSeconds);
            log.info("排放已启动: 总量={}, 速率={}/秒, 窗口[{}, {}]",
                    totalSupply, emission.getTotalEmissionRate(), emission.getStartTime(), emission.getEndTime());
            return emission.copy();
        });
    }

    @Override
    public EmissionSchedule getEmission() {
        return state.execute("getEmission", txn -> txn.emission().copy());
    }
}

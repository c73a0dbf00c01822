package com.bit.gauge.voting.impl;

import com.bit.gauge.asset.GovernancePowerSource;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.state.GaugeState;
import com.bit.gauge.state.StateTransaction;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.vote.VoteRecord;
import com.bit.gauge.voting.WeightAllocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 职责：
 * 维护投票记录与池的投票权重（预留权重由池注册表维护）；
 * 总权重 = 所有池（预留 + 投票）权重之和，任何修改都同时更新池与总量。
 */
@Slf4j
@Service
public class WeightAllocatorImpl implements WeightAllocator {

    private final GaugeState state;
    private final GovernancePowerSource governancePower;

    public WeightAllocatorImpl(GaugeState state, GovernancePowerSource governancePower) {
        this.state = state;
        this.governancePower = governancePower;
    }

    @Override
    public VoteRecord vote(AccountAddress participant, List<Long> poolIds, List<BigInteger> weights) {
        if (poolIds == null || weights == null || poolIds.size() != weights.size()) {
            throw new GaugeException(ErrorType.VOTE_LENGTH_MISMATCH,
                    "pools=" + (poolIds == null ? null : poolIds.size())
                            + ", weights=" + (weights == null ? null : weights.size()));
        }
        return state.execute("vote", txn -> {
            // 全部校验在任何修改之前完成
            BigInteger weightSum = BigInteger.ZERO;
            Set<Long> seen = new HashSet<>();
            for (int i = 0; i < poolIds.size(); i++) {
                Long poolId = poolIds.get(i);
                BigInteger weight = weights.get(i);
                if (poolId == null) {
                    throw new GaugeException(ErrorType.UNKNOWN_POOL, "poolId=null");
                }
                if (weight == null || weight.signum() < 0) {
                    throw new GaugeException(ErrorType.INVALID_VOTE_WEIGHT, "pool=" + poolId + ", weight=" + weight);
                }
                if (!seen.add(poolId)) {
                    throw new GaugeException(ErrorType.DUPLICATE_VOTE_POOL, "pool=" + poolId);
                }
                txn.pool(poolId);
                weightSum = weightSum.add(weight);
            }
            if (weightSum.signum() == 0) {
                throw new GaugeException(ErrorType.VOTE_WEIGHT_ZERO, "participant=" + participant);
            }

            resetIn(txn, participant);

            BigInteger power = governancePower.powerOf(participant);
            VoteRecord record = txn.voteRecord(participant);
            BigInteger used = BigInteger.ZERO;
            for (int i = 0; i < poolIds.size(); i++) {
                long poolId = poolIds.get(i);
                BigInteger allocation = weights.get(i).multiply(power).divide(weightSum);
                Pool pool = txn.pool(poolId);
                pool.setVotedWeight(pool.getVotedWeight().add(allocation));
                txn.setTotalWeight(txn.totalWeight().add(allocation));
                record.getPools().add(poolId);
                record.getAllocations().put(poolId, allocation);
                used = used.add(allocation);
            }
            record.setUsedWeight(used);
            log.info("投票 participant={} power={} pools={} allocations={} totalWeight={}",
                    participant, power, poolIds, record.getAllocations(), txn.totalWeight());
            return record.copy();
        });
    }

    @Override
    public void reset(AccountAddress participant) {
        state.run("resetVotes", txn -> resetIn(txn, participant));
    }

    @Override
    public boolean rebalance() {
        return state.execute("rebalance", txn -> {
            BigInteger totalWeight = txn.totalWeight();
            if (totalWeight.signum() == 0) {
                log.debug("总权重为0，跳过rebalance");
                return false;
            }
            // 先按旧速率结算到当前时间，再切换新速率
            List<Pool> pools = txn.refreshAll();
            BigInteger totalRate = txn.emission().getTotalEmissionRate();
            for (Pool pool : pools) {
                BigInteger rate = totalRate.multiply(pool.getWeight()).divide(totalWeight);
                pool.setEmissionRate(rate);
            }
            log.info("rebalance完成: 池数量={}, 全局速率={}, 总权重={}", pools.size(), totalRate, totalWeight);
            return true;
        });
    }

    @Override
    public VoteRecord getVotes(AccountAddress participant) {
        return state.execute("getVotes", txn -> txn.voteRecord(participant).copy());
    }

    @Override
    public BigInteger getTotalWeight() {
        return state.execute("getTotalWeight", StateTransaction::totalWeight);
    }

    private void resetIn(StateTransaction txn, AccountAddress participant) {
        VoteRecord record = txn.voteRecord(participant);
        if (record.isEmpty()) {
            return;
        }
        for (Long poolId : record.getPools()) {
            BigInteger allocation = record.allocationOf(poolId);
            if (allocation.signum() > 0) {
                Pool pool = txn.pool(poolId);
                pool.setVotedWeight(pool.getVotedWeight().subtract(allocation));
                txn.setTotalWeight(txn.totalWeight().subtract(allocation));
            }
        }
        record.getPools().clear();
        record.getAllocations().clear();
        record.setUsedWeight(BigInteger.ZERO);
        log.debug("已撤销 participant={} 的全部投票", participant);
    }
}

package com.bit.gauge.staking.impl;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.event.GaugeEventType;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.staking.BoostCalculator;
import com.bit.gauge.staking.PositionLedger;
import com.bit.gauge.state.GaugeState;
import com.bit.gauge.state.StateTransaction;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@Service
public class PositionLedgerImpl implements PositionLedger {

    private enum Action {
        DEPOSIT, WITHDRAW, CLAIM
    }

    private final GaugeState state;
    private final BoostCalculator boostCalculator;
    private final BigInteger scale;

    public PositionLedgerImpl(GaugeState state, BoostCalculator boostCalculator, SystemConfig config) {
        this.state = state;
        this.boostCalculator = boostCalculator;
        this.scale = config.scale();
    }

    @Override
    public BigInteger deposit(AccountAddress participant, long poolId, BigInteger amount) {
        checkAmount(amount);
        return state.execute("deposit", txn -> settle(txn, participant, poolId, Action.DEPOSIT, amount));
    }

    @Override
    public BigInteger withdraw(AccountAddress participant, long poolId, BigInteger amount) {
        checkAmount(amount);
        return state.execute("withdraw", txn -> settle(txn, participant, poolId, Action.WITHDRAW, amount));
    }

    @Override
    public BigInteger claim(AccountAddress participant, long poolId) {
        return state.execute("claim", txn -> settle(txn, participant, poolId, Action.CLAIM, BigInteger.ZERO));
    }

    @Override
    public BigInteger claimMany(AccountAddress participant, List<Long> poolIds) {
        if (poolIds == null) {
            throw new GaugeException(ErrorType.UNKNOWN_POOL, "poolIds=null");
        }
        return state.execute("claimMany", txn -> {
            BigInteger total = BigInteger.ZERO;
            for (Long poolId : poolIds) {
                if (poolId == null) {
                    throw new GaugeException(ErrorType.UNKNOWN_POOL, "poolId=null");
                }
                total = total.add(settle(txn, participant, poolId, Action.CLAIM, BigInteger.ZERO));
            }
            return total;
        });
    }

    @Override
    public BigInteger emergencyWithdraw(AccountAddress participant, long poolId) {
        return state.execute("emergencyWithdraw", txn -> {
            checkParticipant(txn, participant);
            Pool pool = txn.pool(poolId);
            Position position = txn.position(poolId, participant);
            BigInteger staked = position.getStakedAmount();
            if (staked.signum() == 0) {
                throw new GaugeException(ErrorType.INSUFFICIENT_STAKE, "池" + poolId + "中没有质押");
            }
            log.warn("紧急取出 pool={} participant={} staked={}，放弃待领奖励{}",
                    poolId, participant, staked, position.pending(pool.getRewardPerShareAccumulated(), scale));
            txn.transfer(pool.getStakedAsset(), txn.custody(), participant, staked);
            position.setStakedAmount(BigInteger.ZERO);
            position.setDerivedStake(BigInteger.ZERO);
            position.setRewardDebt(BigInteger.ZERO);
            txn.emit(GaugeEventType.WITHDRAWAL, poolId, participant, staked);
            return staked;
        });
    }

    @Override
    public Position getPosition(long poolId, AccountAddress participant) {
        return state.execute("getPosition", txn -> txn.position(poolId, participant).copy());
    }

    @Override
    public BigInteger pendingReward(long poolId, AccountAddress participant) {
        return state.execute("pendingReward", txn -> {
            Pool pool = txn.pool(poolId);
            return txn.position(poolId, participant).pending(pool.getRewardPerShareAccumulated(), scale);
        });
    }

    /**
     * 结算流程（deposit / withdraw / claim 共用）
     */
    private BigInteger settle(StateTransaction txn, AccountAddress participant, long poolId,
                              Action action, BigInteger amount) {
        checkParticipant(txn, participant);
        // 1. 刷新池  2. 读取工作快照
        Pool pool = txn.pool(poolId);
        Position position = txn.position(poolId, participant);
        BigInteger accumulated = pool.getRewardPerShareAccumulated();

        if (action == Action.WITHDRAW && amount.compareTo(position.getStakedAmount()) > 0) {
            throw new GaugeException(ErrorType.INSUFFICIENT_STAKE,
                    "取出" + amount + "超过质押" + position.getStakedAmount());
        }

        // 3. 支付待领奖励
        BigInteger paid = BigInteger.ZERO;
        if (position.getDerivedStake().signum() > 0) {
            BigInteger pending = position.pending(accumulated, scale);
            if (pending.signum() < 0) {
                throw new IllegalStateException("Negative rewards should not be possible: pool="
                        + poolId + ", participant=" + participant + ", pending=" + pending);
            }
            if (pending.signum() > 0) {
                txn.transfer(txn.rewardAsset(), txn.custody(), participant, pending);
                txn.emit(GaugeEventType.REWARD_PAID, poolId, participant, pending);
                paid = pending;
            }
        }

        // 4. 变更质押并转移质押资产
        if (action == Action.DEPOSIT) {
            txn.transfer(pool.getStakedAsset(), participant, txn.custody(), amount);
            position.setStakedAmount(position.getStakedAmount().add(amount));
            txn.emit(GaugeEventType.DEPOSIT, poolId, participant, amount);
        } else if (action == Action.WITHDRAW) {
            position.setStakedAmount(position.getStakedAmount().subtract(amount));
            txn.transfer(pool.getStakedAsset(), txn.custody(), participant, amount);
            txn.emit(GaugeEventType.WITHDRAWAL, poolId, participant, amount);
        }

        // 5. 按新的质押重算派生质押  6. 债务基线对齐当前累加器，结算后待领奖励为0
        BigInteger derived = boostCalculator.recomputeDerivedStake(txn, pool, position);
        position.setRewardDebt(derived.multiply(accumulated).divide(scale));

        log.info("{} pool={} participant={} amount={} paid={} staked={} derived={}",
                action, poolId, participant, amount, paid, position.getStakedAmount(), derived);
        return paid;
    }

    /**
     * 托管账户自身转账不移动资产，不能持有头寸
     */
    private static void checkParticipant(StateTransaction txn, AccountAddress participant) {
        if (participant == null || participant.equals(txn.custody())) {
            throw new GaugeException(ErrorType.INVALID_PARTICIPANT, "participant=" + participant);
        }
    }

    private static void checkAmount(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new GaugeException(ErrorType.INVALID_AMOUNT, "amount=" + amount);
        }
    }
}

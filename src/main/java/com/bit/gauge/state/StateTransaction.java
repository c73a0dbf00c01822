package com.bit.gauge.state;

import com.bit.gauge.asset.AssetTransferException;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.event.GaugeEvent;
import com.bit.gauge.event.GaugeEventType;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;
import com.bit.gauge.structure.position.PositionKey;
import com.bit.gauge.structure.vote.VoteRecord;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次操作的工作单元：快照 -> 修改 -> 提交
 *
 * 池快照在交出之前一定先刷新累加器，头寸快照在其所属池刷新之后才读取，
 * 调用方拿不到任何未刷新的池或头寸。
 */
@Slf4j
public class StateTransaction {

    private final GaugeState state;
    private final long now;

    // 工作快照（提交前对已提交状态不可见）
    private final Map<Long, Pool> pools = new LinkedHashMap<>();
    private final List<Pool> createdPools = new ArrayList<>();
    private final Map<PositionKey, Position> positions = new LinkedHashMap<>();
    private final Map<AccountAddress, VoteRecord> votes = new LinkedHashMap<>();
    private BigInteger totalWeight;
    private EmissionSchedule emission;

    // 已执行的转账（回滚时倒序补偿）
    private final Deque<TransferRecord> journal = new ArrayDeque<>();
    // 提交后发布的事件
    private final List<GaugeEvent> events = new ArrayList<>();

    StateTransaction(GaugeState state, long now) {
        this.state = state;
        this.now = now;
        this.totalWeight = state.totalWeight;
        this.emission = state.emission.copy();
    }

    public long now() {
        return now;
    }

    public AccountAddress custody() {
        return state.custody;
    }

    public AssetId rewardAsset() {
        return state.rewardAsset;
    }

    // ==================== 池 ====================

    public int poolCount() {
        return state.pools.size() + createdPools.size();
    }

    /**
     * 取池的工作快照，交出前刷新累加器
     * @throws GaugeException UNKNOWN_POOL
     */
    public Pool pool(long poolId) {
        Pool pool = pools.get(poolId);
        if (pool == null) {
            if (poolId < 0 || poolId >= state.pools.size()) {
                throw new GaugeException(ErrorType.UNKNOWN_POOL, "poolId=" + poolId);
            }
            pool = state.pools.get((int) poolId).copy();
            pools.put(poolId, pool);
        }
        Pool target = pool;
        state.accumulator.accrue(target, emission, now, () -> stakedBalance(target));
        return pool;
    }

    /**
     * 刷新全部池（速率变化前调用，避免已产生未记录的奖励按新速率计算）
     */
    public List<Pool> refreshAll() {
        List<Pool> all = new ArrayList<>(poolCount());
        for (long id = 0; id < poolCount(); id++) {
            all.add(pool(id));
        }
        return all;
    }

    public Long findPoolId(AssetId stakedAsset) {
        Long id = state.poolIndex.get(stakedAsset);
        if (id != null) {
            return id;
        }
        for (Pool created : createdPools) {
            if (created.getStakedAsset().equals(stakedAsset)) {
                return created.getPoolId();
            }
        }
        return null;
    }

    public Pool addPool(AssetId stakedAsset, BigInteger reservedWeight) {
        Pool pool = new Pool(poolCount(), stakedAsset, reservedWeight, now);
        createdPools.add(pool);
        pools.put(pool.getPoolId(), pool);
        return pool;
    }

    /**
     * 池当前质押总量（托管账户在该质押资产上的余额），每次实时查询
     */
    public BigInteger stakedBalance(Pool pool) {
        return state.ledger.balanceOf(pool.getStakedAsset(), state.custody);
    }

    // ==================== 头寸 ====================

    /**
     * 取头寸的工作快照；先刷新所属池，再读取头寸
     */
    public Position position(long poolId, AccountAddress participant) {
        pool(poolId);
        PositionKey key = new PositionKey(poolId, participant);
        Position position = positions.get(key);
        if (position == null) {
            Position committed = state.positions.get(key);
            position = committed != null ? committed.copy() : new Position(poolId, participant);
            positions.put(key, position);
        }
        return position;
    }

    // ==================== 投票 ====================

    public VoteRecord voteRecord(AccountAddress participant) {
        VoteRecord record = votes.get(participant);
        if (record == null) {
            VoteRecord committed = state.votes.get(participant);
            record = committed != null ? committed.copy() : new VoteRecord(participant);
            votes.put(participant, record);
        }
        return record;
    }

    public BigInteger totalWeight() {
        return totalWeight;
    }

    public void setTotalWeight(BigInteger totalWeight) {
        if (totalWeight.signum() < 0) {
            throw new IllegalStateException("总权重不能为负数: " + totalWeight);
        }
        this.totalWeight = totalWeight;
    }

    // ==================== 排放 ====================

    public EmissionSchedule emission() {
        return emission;
    }

    // ==================== 转账与事件 ====================

    /**
     * 通过外部账本转账，并记入日志以便回滚
     * @throws GaugeException TRANSFER_FAILED
     */
    public void transfer(AssetId asset, AccountAddress from, AccountAddress to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        try {
            state.ledger.transfer(asset, from, to, amount);
        } catch (AssetTransferException e) {
            throw new GaugeException(ErrorType.TRANSFER_FAILED, e.getMessage(), e);
        }
        journal.push(new TransferRecord(asset, from, to, amount));
    }

    public void emit(GaugeEventType type, long poolId, AccountAddress participant, BigInteger amount) {
        events.add(new GaugeEvent(type, poolId, participant, amount, now));
    }

    // ==================== 提交 / 回滚 ====================

    List<GaugeEvent> commit() {
        for (Pool created : createdPools) {
            state.pools.add(created);
            state.poolIndex.put(created.getStakedAsset(), created.getPoolId());
        }
        for (Map.Entry<Long, Pool> entry : pools.entrySet()) {
            state.pools.set(entry.getKey().intValue(), entry.getValue());
        }
        for (Map.Entry<PositionKey, Position> entry : positions.entrySet()) {
            if (entry.getValue().isEmpty()) {
                state.positions.remove(entry.getKey());
            } else {
                state.positions.put(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<AccountAddress, VoteRecord> entry : votes.entrySet()) {
            if (entry.getValue().isEmpty()) {
                state.votes.remove(entry.getKey());
            } else {
                state.votes.put(entry.getKey(), entry.getValue());
            }
        }
        state.totalWeight = totalWeight;
        state.emission = emission;
        return events;
    }

    void rollback(RuntimeException cause) {
        while (!journal.isEmpty()) {
            TransferRecord record = journal.pop();
            try {
                state.ledger.transfer(record.asset, record.to, record.from, record.amount);
            } catch (RuntimeException e) {
                log.error("补偿转账失败 asset={} from={} to={} amount={}",
                        record.asset, record.to, record.from, record.amount, e);
                cause.addSuppressed(new GaugeException(ErrorType.ROLLBACK_FAILED, record.toString(), e));
            }
        }
    }

    private static final class TransferRecord {
        private final AssetId asset;
        private final AccountAddress from;
        private final AccountAddress to;
        private final BigInteger amount;

        private TransferRecord(AssetId asset, AccountAddress from, AccountAddress to, BigInteger amount) {
            this.asset = asset;
            this.from = from;
            this.to = to;
            this.amount = amount;
        }

        @Override
        public String toString() {
            return "asset=" + asset + ", from=" + from + ", to=" + to + ", amount=" + amount;
        }
    }
}

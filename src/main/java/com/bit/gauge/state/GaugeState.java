package com.bit.gauge.state;

import com.bit.gauge.asset.AssetLedger;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.event.GaugeEvent;
import com.bit.gauge.reward.RewardAccumulator;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;
import com.bit.gauge.structure.position.PositionKey;
import com.bit.gauge.structure.vote.VoteRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 引擎全局状态：池（按编号顺序存放）、头寸（池 × 参与者）、投票记录、总权重、排放计划
 *
 * 所有读写都必须经过 {@link #execute}：
 * 全局锁串行化 -> 在 {@link StateTransaction} 中对工作快照修改 -> 成功后一次性提交 -> 发布事件；
 * 任一步失败则丢弃快照并反向补偿已执行的转账，外部看不到任何中间状态。
 */
@Slf4j
@Component
public class GaugeState {

    // ==================== 已提交状态（仅 StateTransaction 可访问） ====================
    final List<Pool> pools = new ArrayList<>();
    final Map<AssetId, Long> poolIndex = new HashMap<>();
    final Map<PositionKey, Position> positions = new HashMap<>();
    final Map<AccountAddress, VoteRecord> votes = new HashMap<>();
    BigInteger totalWeight = BigInteger.ZERO;
    EmissionSchedule emission = new EmissionSchedule();

    // ==================== 依赖组件 ====================
    final AssetLedger ledger;
    final RewardAccumulator accumulator;
    final AccountAddress custody;
    final AssetId rewardAsset;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    // 单一串行化点
    private final ReentrantLock lock = new ReentrantLock();

    public GaugeState(AssetLedger ledger, RewardAccumulator accumulator, SystemConfig config,
                      Clock clock, ApplicationEventPublisher publisher) {
        this.ledger = ledger;
        this.accumulator = accumulator;
        this.custody = config.custodyAddress();
        this.rewardAsset = config.rewardAssetId();
        this.clock = clock;
        this.publisher = publisher;
    }

    /**
     * 以单个事务执行一次操作
     * @param operation 操作名（日志用）
     * @param work 在事务内执行的逻辑
     * @return work 的返回值
     */
    public <T> T execute(String operation, Function<StateTransaction, T> work) {
        if (lock.isHeldByCurrentThread()) {
            // 嵌套事务会独立提交，破坏原子性
            throw new IllegalStateException("操作" + operation + "不允许在另一个操作内部执行");
        }
        lock.lock();
        try {
            StateTransaction txn = new StateTransaction(this, clock.instant().getEpochSecond());
            T result;
            try {
                result = work.apply(txn);
            } catch (RuntimeException e) {
                log.warn("操作{}失败，回滚全部变更: {}", operation, e.getMessage());
                txn.rollback(e);
                throw e;
            }
            List<GaugeEvent> events = txn.commit();
            log.debug("操作{}提交完成，事件数: {}", operation, events.size());
            for (GaugeEvent event : events) {
                try {
                    publisher.publishEvent(event);
                } catch (RuntimeException e) {
                    // 事件仅供观察，状态已提交
                    log.error("事件发布失败: {}", event, e);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Consumer<StateTransaction> work) {
        execute(operation, txn -> {
            work.accept(txn);
            return null;
        });
    }
}

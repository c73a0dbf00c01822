package com.bit.gauge.state;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.event.GaugeEventType;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.reward.RewardAccumulator;
import com.bit.gauge.support.GaugeFixture;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.bit.gauge.support.GaugeFixture.T0;
import static com.bit.gauge.support.GaugeFixture.big;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class GaugeStateTest {

    private GaugeFixture f;

    private final AccountAddress alice = AccountAddress.of(0xa1);
    private final AccountAddress bob = AccountAddress.of(0xb2);
    private final AssetId token = AssetId.of(0x77);

    @BeforeEach
    void setUp() {
        f = new GaugeFixture();
    }

    @Test
    void testNestedExecuteRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> f.state.run("outer", txn -> f.poolRegistry.poolCount()));
        log.info("嵌套调用被拒绝: {}", e.getMessage());
        // 锁已释放，后续操作正常
        assertEquals(0, f.poolRegistry.poolCount());
    }

    @Test
    void testChangesInvisibleUntilCommit() {
        f.state.run("stage", txn -> {
            txn.addPool(token, big(5));
            txn.setTotalWeight(big(5));
            assertEquals(1, txn.poolCount());
            assertTrue(f.state.pools.isEmpty());
            assertEquals(BigInteger.ZERO, f.state.totalWeight);
        });
        assertEquals(1, f.state.pools.size());
        assertEquals(big(5), f.state.totalWeight);
        assertEquals(Long.valueOf(0), f.state.poolIndex.get(token));
    }

    @Test
    void testFailureDiscardsSnapshotsAndReversesTransfers() {
        f.ledger.mint(token, alice, big(100));
        assertThrows(GaugeException.class, () -> f.state.run("fail", txn -> {
            txn.addPool(token, big(5));
            txn.setTotalWeight(big(5));
            txn.transfer(token, alice, bob, big(60));
            txn.emit(GaugeEventType.DEPOSIT, 0, alice, big(60));
            throw new GaugeException(ErrorType.INVALID_AMOUNT, "模拟失败");
        }));
        assertTrue(f.state.pools.isEmpty());
        assertEquals(BigInteger.ZERO, f.state.totalWeight);
        assertEquals(big(100), f.ledger.balanceOf(token, alice));
        assertEquals(BigInteger.ZERO, f.ledger.balanceOf(token, bob));
        assertTrue(f.events.isEmpty());
    }

    @Test
    void testCompensationFailureIsSuppressed() {
        f.ledger.mint(token, alice, big(100));
        GaugeException e = assertThrows(GaugeException.class, () -> f.state.run("fail", txn -> {
            txn.transfer(token, alice, bob, big(100));
            // 接收方余额被外部转走，反向补偿无法完成
            f.ledger.burn(token, bob, big(100));
            throw new GaugeException(ErrorType.INVALID_AMOUNT, "模拟失败");
        }));
        assertEquals(ErrorType.INVALID_AMOUNT, e.getErrorType());
        assertEquals(1, e.getSuppressed().length);
        assertEquals(ErrorType.ROLLBACK_FAILED, ((GaugeException) e.getSuppressed()[0]).getErrorType());
    }

    @Test
    void testListenerFailureDoesNotUndoCommit() {
        GaugeState state = new GaugeState(f.ledger, new RewardAccumulator(f.config), f.config, f.clock, event -> {
            throw new IllegalStateException("listener down");
        });
        state.run("emit", txn -> {
            txn.setTotalWeight(big(9));
            txn.emit(GaugeEventType.REWARD_PAID, 0, alice, big(1));
        });
        assertEquals(big(9), state.totalWeight);
    }

    @Test
    void testReadsRefreshBeforeReturning() {
        long poolId = f.registerPool(1, 0);
        f.clock.advance(25);
        assertEquals(T0, f.state.pools.get((int) poolId).getLastDistributionTime());
        f.state.run("read", txn -> assertEquals(T0 + 25, txn.pool(poolId).getLastDistributionTime()));
        assertEquals(T0 + 25, f.state.pools.get((int) poolId).getLastDistributionTime());
    }

    @Test
    void testSkippedRebalanceDoesNotRefresh() {
        long poolId = f.registerPool(1, 0);
        f.clock.advance(60);
        assertFalse(f.weightAllocator.rebalance());
        assertEquals(T0, f.state.pools.get((int) poolId).getLastDistributionTime());
    }

    @Test
    void testEmptyRecordsAreNotKept() {
        long poolId = f.registerPool(1, 0);
        f.positionLedger.getPosition(poolId, alice);
        f.weightAllocator.getVotes(alice);
        assertTrue(f.state.positions.isEmpty());
        assertTrue(f.state.votes.isEmpty());
    }
}

package com.bit.gauge.voting;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.structure.vote.VoteRecord;
import com.bit.gauge.support.GaugeFixture;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.bit.gauge.support.GaugeFixture.big;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class WeightAllocatorTest {

    private GaugeFixture f;
    private long p0;
    private long p1;
    private long p2;

    private final AccountAddress alice = AccountAddress.of(0xa1);
    private final AccountAddress bob = AccountAddress.of(0xb2);

    @BeforeEach
    void setUp() {
        f = new GaugeFixture();
        p0 = f.registerPool(1, 100);
        p1 = f.registerPool(2, 0);
        p2 = f.registerPool(3, 0);
        f.power.setPower(alice, big(1000));
        f.power.setPower(bob, big(500));
    }

    private void assertWeightsConsistent() {
        BigInteger sum = BigInteger.ZERO;
        for (long id = 0; id < f.poolRegistry.poolCount(); id++) {
            sum = sum.add(f.poolRegistry.getPool(id).getWeight());
        }
        assertEquals(sum, f.weightAllocator.getTotalWeight());
    }

    @Test
    void testVoteAllocatesProportionally() {
        VoteRecord record = f.weightAllocator.vote(alice, Arrays.asList(p1, p2), Arrays.asList(big(1), big(3)));
        log.info("投票记录: {}", record.getAllocations());
        assertEquals(big(250), record.allocationOf(p1));
        assertEquals(big(750), record.allocationOf(p2));
        assertEquals(big(1000), record.getUsedWeight());
        assertEquals(big(250), f.poolRegistry.getPool(p1).getVotedWeight());
        assertEquals(big(750), f.poolRegistry.getPool(p2).getVotedWeight());
        assertEquals(big(1100), f.weightAllocator.getTotalWeight());
        assertWeightsConsistent();
    }

    @Test
    void testNormalizationRoundsDown() {
        VoteRecord record = f.weightAllocator.vote(alice, Arrays.asList(p1, p2), Arrays.asList(big(1), big(2)));
        assertEquals(big(333), record.allocationOf(p1));
        assertEquals(big(666), record.allocationOf(p2));
        assertTrue(record.getUsedWeight().compareTo(big(1000)) <= 0);
        assertWeightsConsistent();
    }

    @Test
    void testRevoteRemovesPreviousAllocations() {
        f.weightAllocator.vote(alice, Collections.singletonList(p1), Collections.singletonList(big(1)));
        f.weightAllocator.vote(bob, Collections.singletonList(p1), Collections.singletonList(big(1)));
        assertEquals(big(1500), f.poolRegistry.getPool(p1).getVotedWeight());

        VoteRecord record = f.weightAllocator.vote(alice, Collections.singletonList(p2), Collections.singletonList(big(7)));
        assertEquals(BigInteger.ZERO, record.allocationOf(p1));
        assertEquals(Collections.singletonList(p2), record.getPools());
        // p1 只剩 bob 的投票
        assertEquals(big(500), f.poolRegistry.getPool(p1).getVotedWeight());
        assertEquals(big(1000), f.poolRegistry.getPool(p2).getVotedWeight());
        assertEquals(big(1600), f.weightAllocator.getTotalWeight());
        assertWeightsConsistent();
    }

    @Test
    void testRevoteUsesCurrentPower() {
        f.weightAllocator.vote(alice, Collections.singletonList(p1), Collections.singletonList(big(1)));
        f.power.setPower(alice, big(200));
        f.weightAllocator.vote(alice, Collections.singletonList(p1), Collections.singletonList(big(1)));
        assertEquals(big(200), f.poolRegistry.getPool(p1).getVotedWeight());
        assertWeightsConsistent();
    }

    @Test
    void testReset() {
        f.weightAllocator.vote(alice, Arrays.asList(p0, p1), Arrays.asList(big(1), big(1)));
        f.weightAllocator.reset(alice);
        assertTrue(f.weightAllocator.getVotes(alice).isEmpty());
        assertEquals(big(100), f.poolRegistry.getPool(p0).getWeight());
        assertEquals(BigInteger.ZERO, f.poolRegistry.getPool(p1).getWeight());
        assertEquals(big(100), f.weightAllocator.getTotalWeight());
        // 没有投票时重置无副作用
        f.weightAllocator.reset(bob);
        assertEquals(big(100), f.weightAllocator.getTotalWeight());
    }

    @Test
    void testInvalidVotesLeavePreviousVoteIntact() {
        f.weightAllocator.vote(alice, Collections.singletonList(p1), Collections.singletonList(big(1)));

        assertVoteError(ErrorType.VOTE_LENGTH_MISMATCH, Arrays.asList(p1, p2), Collections.singletonList(big(1)));
        assertVoteError(ErrorType.VOTE_WEIGHT_ZERO, Arrays.asList(p1, p2), Arrays.asList(big(0), big(0)));
        assertVoteError(ErrorType.INVALID_VOTE_WEIGHT, Arrays.asList(p1, p2), Arrays.asList(big(-1), big(5)));
        assertVoteError(ErrorType.DUPLICATE_VOTE_POOL, Arrays.asList(p2, p2), Arrays.asList(big(1), big(1)));
        assertVoteError(ErrorType.UNKNOWN_POOL, Arrays.asList(p2, 99L), Arrays.asList(big(1), big(1)));
        assertVoteError(ErrorType.UNKNOWN_POOL, Arrays.asList(p2, null), Arrays.asList(big(1), big(1)));

        VoteRecord record = f.weightAllocator.getVotes(alice);
        assertEquals(big(1000), record.allocationOf(p1));
        assertEquals(big(1000), f.poolRegistry.getPool(p1).getVotedWeight());
        assertEquals(BigInteger.ZERO, f.poolRegistry.getPool(p2).getVotedWeight());
        assertEquals(big(1100), f.weightAllocator.getTotalWeight());
    }

    private void assertVoteError(ErrorType expected, List<Long> pools, List<BigInteger> weights) {
        GaugeException e = assertThrows(GaugeException.class, () -> f.weightAllocator.vote(alice, pools, weights));
        assertEquals(expected, e.getErrorType());
    }

    @Test
    void testRebalanceDistributesByWeight() {
        f.startEmissions(100);
        f.weightAllocator.vote(alice, Collections.singletonList(p1), Collections.singletonList(big(1)));
        f.weightAllocator.vote(bob, Collections.singletonList(p2), Collections.singletonList(big(1)));
        assertTrue(f.weightAllocator.rebalance());

        // 总权重 100 + 1000 + 500
        assertEquals(big(100 * 100 / 1600), f.poolRegistry.getPool(p0).getEmissionRate());
        assertEquals(big(100 * 1000 / 1600), f.poolRegistry.getPool(p1).getEmissionRate());
        assertEquals(big(100 * 500 / 1600), f.poolRegistry.getPool(p2).getEmissionRate());
    }

    @Test
    void testRebalanceWithZeroTotalWeightIsNoop() {
        f.startEmissions(10);
        assertTrue(f.weightAllocator.rebalance());
        assertEquals(big(10), f.poolRegistry.getPool(p0).getEmissionRate());

        f.poolRegistry.releaseReservedWeight(f.governor, p0, true);
        assertEquals(BigInteger.ZERO, f.weightAllocator.getTotalWeight());

        f.clock.advance(60);
        assertFalse(f.weightAllocator.rebalance());
        // 速率保持不变
        assertEquals(big(10), f.poolRegistry.getPool(p0).getEmissionRate());
        assertEquals(BigInteger.ZERO, f.poolRegistry.getPool(p1).getEmissionRate());
    }
}

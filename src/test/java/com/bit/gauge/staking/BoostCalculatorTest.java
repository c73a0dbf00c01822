package com.bit.gauge.staking;

import com.bit.gauge.asset.memory.MemoryGovernancePower;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.staking.impl.BoostCalculatorImpl;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.bit.gauge.support.GaugeFixture.big;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class BoostCalculatorTest {

    private final BoostCalculator calculator = new BoostCalculatorImpl(new MemoryGovernancePower(), new SystemConfig());

    @Test
    void testNoGovernancePowerGivesBaseOnly() {
        // 40% * 1000
        assertEquals(big(400), calculator.derivedStake(big(1000), big(5000), BigInteger.ZERO, big(100)));
    }

    @Test
    void testZeroTotalPowerGivesBaseOnly() {
        assertEquals(big(400), calculator.derivedStake(big(1000), big(5000), BigInteger.ZERO, BigInteger.ZERO));
    }

    @Test
    void testPartialBoost() {
        // base 400 + (2000 * 10 / 100) * 60% = 400 + 120
        BigInteger derived = calculator.derivedStake(big(1000), big(2000), big(10), big(100));
        log.info("派生质押: {}", derived);
        assertEquals(big(520), derived);
    }

    @Test
    void testBoostIsCappedAtStakedAmount() {
        // base 400 + (10000 * 50 / 100) * 60% = 3400，上限 1000
        assertEquals(big(1000), calculator.derivedStake(big(1000), big(10000), big(50), big(100)));
    }

    @Test
    void testDerivedNeverExceedsStaked() {
        for (long staked = 1; staked < 2000; staked += 97) {
            for (long power = 0; power <= 100; power += 25) {
                BigInteger derived = calculator.derivedStake(big(staked), big(staked * 3), big(power), big(100));
                assertTrue(derived.compareTo(big(staked)) <= 0, "staked=" + staked + ", power=" + power);
                assertTrue(derived.signum() >= 0);
            }
        }
    }

    @Test
    void testCustomBasePercent() {
        SystemConfig config = new SystemConfig();
        config.setBoostBasePercent(100);
        BoostCalculator fullBase = new BoostCalculatorImpl(new MemoryGovernancePower(), config);
        assertEquals(big(1000), fullBase.derivedStake(big(1000), big(1000), big(100), big(100)));
        assertEquals(big(1000), fullBase.derivedStake(big(1000), big(1000), BigInteger.ZERO, big(100)));
    }
}

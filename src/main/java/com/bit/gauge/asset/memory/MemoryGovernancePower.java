package com.bit.gauge.asset.memory;

import com.bit.gauge.asset.GovernancePowerSource;
import com.bit.gauge.common.AccountAddress;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存治理权力表：每个地址的当前投票权由外部直接设定，总量为各地址之和
 */
@Component
public class MemoryGovernancePower implements GovernancePowerSource {

    private final Map<AccountAddress, BigInteger> powers = new ConcurrentHashMap<>();

    @Override
    public BigInteger powerOf(AccountAddress account) {
        return powers.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public BigInteger totalPower() {
        return powers.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public void setPower(AccountAddress account, BigInteger power) {
        if (power == null || power.signum() < 0) {
            throw new IllegalArgumentException("治理权力不能为负数: " + power);
        }
        if (power.signum() == 0) {
            powers.remove(account);
        } else {
            powers.put(account, power);
        }
    }
}

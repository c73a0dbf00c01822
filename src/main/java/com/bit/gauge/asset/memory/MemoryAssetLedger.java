package com.bit.gauge.asset.memory;

import com.bit.gauge.asset.AssetLedger;
import com.bit.gauge.asset.AssetTransferException;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存同质化资产账本：铸造 / 销毁 / 转账记账
 */
@Slf4j
@Component
public class MemoryAssetLedger implements AssetLedger {

    // 资产 -> (持有者 -> 余额)
    private final Map<AssetId, Map<AccountAddress, BigInteger>> balances = new ConcurrentHashMap<>();

    @Override
    public BigInteger balanceOf(AssetId asset, AccountAddress holder) {
        Map<AccountAddress, BigInteger> holders = balances.get(asset);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        return holders.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(AssetId asset, AccountAddress from, AccountAddress to, BigInteger amount) {
        checkAmount(amount);
        BigInteger fromBalance = balanceOf(asset, from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new AssetTransferException("余额不足: asset=" + asset + ", from=" + from
                    + ", balance=" + fromBalance + ", amount=" + amount);
        }
        if (amount.signum() == 0 || from.equals(to)) {
            return;
        }
        Map<AccountAddress, BigInteger> holders = holdersOf(asset);
        holders.put(from, fromBalance.subtract(amount));
        holders.merge(to, amount, BigInteger::add);
        log.debug("转账完成 asset={} from={} to={} amount={}", asset, from, to, amount);
    }

    public synchronized void mint(AssetId asset, AccountAddress to, BigInteger amount) {
        checkAmount(amount);
        holdersOf(asset).merge(to, amount, BigInteger::add);
    }

    public synchronized void burn(AssetId asset, AccountAddress from, BigInteger amount) {
        checkAmount(amount);
        BigInteger fromBalance = balanceOf(asset, from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new AssetTransferException("销毁数量超过余额: asset=" + asset + ", from=" + from);
        }
        holdersOf(asset).put(from, fromBalance.subtract(amount));
    }

    private Map<AccountAddress, BigInteger> holdersOf(AssetId asset) {
        return balances.computeIfAbsent(asset, k -> new ConcurrentHashMap<>());
    }

    private static void checkAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new AssetTransferException("金额非法: " + amount);
        }
    }
}

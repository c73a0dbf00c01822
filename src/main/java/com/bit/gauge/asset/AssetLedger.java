package com.bit.gauge.asset;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;

import java.math.BigInteger;

/**
 * 外部资产账本：引擎只依赖余额查询与转账两个能力
 * 奖励资产、各池质押资产都通过该接口流转
 */
public interface AssetLedger {

    /**
     * 查询持有者在某资产上的余额，不存在时返回0
     */
    BigInteger balanceOf(AssetId asset, AccountAddress holder);

    /**
     * 转账
     * @throws AssetTransferException 余额不足或转账被拒绝
     */
    void transfer(AssetId asset, AccountAddress from, AccountAddress to, BigInteger amount);
}

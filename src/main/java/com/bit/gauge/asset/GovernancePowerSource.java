package com.bit.gauge.asset;

import com.bit.gauge.common.AccountAddress;

import java.math.BigInteger;

/**
 * 治理权力来源（锁仓投票权），视为只读预言机
 * 每次计算都必须实时查询，不允许跨操作缓存
 */
public interface GovernancePowerSource {

    BigInteger powerOf(AccountAddress account);

    BigInteger totalPower();
}

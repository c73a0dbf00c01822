package com.bit.gauge.staking;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.structure.position.Position;

import java.math.BigInteger;
import java.util.List;

/**
 * 质押头寸服务
 * 职责：
 * 存入 / 取出 / 领取奖励，每次变更都按 刷新池 -> 结算待领奖励 -> 变更质押 -> 重算派生质押 -> 重置债务 的顺序执行；
 * 每个操作要么整体成功，要么整体失败且无任何状态或余额变化。
 */
public interface PositionLedger {

    /**
     * 存入质押资产，同时结算已产生的奖励
     * @return 本次支付的奖励
     */
    BigInteger deposit(AccountAddress participant, long poolId, BigInteger amount);

    /**
     * 取出质押资产，同时结算已产生的奖励；超过质押数量直接拒绝
     * @return 本次支付的奖励
     */
    BigInteger withdraw(AccountAddress participant, long poolId, BigInteger amount);

    /**
     * 领取单个池的奖励
     */
    BigInteger claim(AccountAddress participant, long poolId);

    /**
     * 在一个事务内领取多个池的奖励
     * @return 支付的奖励合计
     */
    BigInteger claimMany(AccountAddress participant, List<Long> poolIds);

    /**
     * 紧急取出：取回全部质押并放弃待领奖励
     * @return 取回的质押数量
     */
    BigInteger emergencyWithdraw(AccountAddress participant, long poolId);

    /**
     * 头寸快照（读取前先刷新池）
     */
    Position getPosition(long poolId, AccountAddress participant);

    /**
     * 当前待领奖励（读取前先刷新池）
     */
    BigInteger pendingReward(long poolId, AccountAddress participant);
}

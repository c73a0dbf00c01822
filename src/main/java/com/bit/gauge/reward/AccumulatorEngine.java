package com.bit.gauge.reward;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;

import java.math.BigInteger;

/**
 * 奖励累加器服务
 * 职责：
 * 维护每个池的 reward-per-share 累加器，任何读取池或头寸之前都先刷新；
 * 管理一次性的排放计划（注入奖励总量、固定一年窗口、全局排放速率）。
 */
public interface AccumulatorEngine {

    /**
     * 把单个池的累加器推进到当前时间
     * @return 刷新后的池快照
     */
    Pool refresh(long poolId);

    /**
     * 刷新全部池，任何人都可以调用
     */
    void refreshAll();

    /**
     * 启动排放：从调用者拉入奖励总量，窗口一年，速率 = totalSupply / 窗口秒数；只能调用一次
     * @param caller 治理者
     * @param totalSupply 待分发的奖励总量
     */
    EmissionSchedule startEmissions(AccountAddress caller, BigInteger totalSupply);

    EmissionSchedule getEmission();
}

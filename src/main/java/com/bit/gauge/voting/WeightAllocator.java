package com.bit.gauge.voting;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.structure.vote.VoteRecord;

import java.math.BigInteger;
import java.util.List;

/**
 * 投票权重分配服务
 * 职责：
 * 按治理权力把参与者的投票按比例归一化到各池（每次投票先整体撤销上一次）；
 * rebalance 时把池权重换算为各池排放速率。
 */
public interface WeightAllocator {

    /**
     * 投票：allocation_i = weights_i * power / sum(weights)
     * @return 新的投票记录
     */
    VoteRecord vote(AccountAddress participant, List<Long> poolIds, List<BigInteger> weights);

    /**
     * 撤销参与者的全部投票；没有投票时为空操作
     */
    void reset(AccountAddress participant);

    /**
     * 按当前权重重新分配排放速率：rate = totalRate * poolWeight / totalWeight
     * 总权重为0时不做任何事（不刷新、不改速率）
     * @return 是否生效
     */
    boolean rebalance();

    VoteRecord getVotes(AccountAddress participant);

    BigInteger getTotalWeight();
}

package com.bit.gauge.api;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.event.GaugeEvent;
import com.bit.gauge.event.RecentEventStore;
import com.bit.gauge.pool.PoolRegistry;
import com.bit.gauge.result.Result;
import com.bit.gauge.staking.PositionLedger;
import com.bit.gauge.structure.dto.ClaimManyRequest;
import com.bit.gauge.structure.dto.StakeRequest;
import com.bit.gauge.structure.pool.Pool;
import com.bit.gauge.structure.position.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/gauge")
public class GaugeApi {

    @Autowired
    private PositionLedger positionLedger;

    @Autowired
    private PoolRegistry poolRegistry;

    @Autowired
    private RecentEventStore recentEventStore;

    // 存入质押，返回本次结算的奖励
    @PostMapping("/deposit")
    public Result<BigInteger> deposit(@RequestBody StakeRequest req) {
        return Result.OK(positionLedger.deposit(req.getParticipant(), req.getPoolId(), req.getAmount()));
    }

    // 取出质押，返回本次结算的奖励
    @PostMapping("/withdraw")
    public Result<BigInteger> withdraw(@RequestBody StakeRequest req) {
        return Result.OK(positionLedger.withdraw(req.getParticipant(), req.getPoolId(), req.getAmount()));
    }

    @PostMapping("/claim")
    public Result<BigInteger> claim(@RequestBody StakeRequest req) {
        return Result.OK(positionLedger.claim(req.getParticipant(), req.getPoolId()));
    }

    @PostMapping("/claimMany")
    public Result<BigInteger> claimMany(@RequestBody ClaimManyRequest req) {
        return Result.OK(positionLedger.claimMany(req.getParticipant(), req.getPoolIds()));
    }

    // 放弃奖励，取回全部质押
    @PostMapping("/emergencyWithdraw")
    public Result<BigInteger> emergencyWithdraw(@RequestBody StakeRequest req) {
        return Result.OK(positionLedger.emergencyWithdraw(req.getParticipant(), req.getPoolId()));
    }

    @GetMapping("/pool")
    public Result<Pool> getPool(@RequestParam long poolId) {
        return Result.OK(poolRegistry.getPool(poolId));
    }

    @GetMapping("/poolCount")
    public Result<Integer> poolCount() {
        return Result.OK(poolRegistry.poolCount());
    }

    @GetMapping("/position")
    public Result<Position> getPosition(@RequestParam long poolId, @RequestParam String participant) {
        return Result.OK(positionLedger.getPosition(poolId, AccountAddress.fromHex(participant)));
    }

    @GetMapping("/pending")
    public Result<BigInteger> pendingReward(@RequestParam long poolId, @RequestParam String participant) {
        return Result.OK(positionLedger.pendingReward(poolId, AccountAddress.fromHex(participant)));
    }

    // 最近的存入 / 取出 / 奖励支付事件
    @GetMapping("/events")
    public Result<List<GaugeEvent>> events(@RequestParam(defaultValue = "100") int limit) {
        return Result.OK(recentEventStore.recent(limit));
    }
}

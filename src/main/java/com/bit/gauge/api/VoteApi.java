package com.bit.gauge.api;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.result.Result;
import com.bit.gauge.reward.AccumulatorEngine;
import com.bit.gauge.structure.dto.VoteRequest;
import com.bit.gauge.structure.vote.VoteRecord;
import com.bit.gauge.voting.WeightAllocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@Slf4j
@RestController
@RequestMapping("/vote")
public class VoteApi {

    @Autowired
    private WeightAllocator weightAllocator;

    @Autowired
    private AccumulatorEngine accumulatorEngine;

    @PostMapping("/cast")
    public Result<VoteRecord> vote(@RequestBody VoteRequest req) {
        return Result.OK(weightAllocator.vote(req.getParticipant(), req.getPoolIds(), req.getWeights()));
    }

    @PostMapping("/reset")
    public Result<Void> reset(@RequestParam String participant) {
        weightAllocator.reset(AccountAddress.fromHex(participant));
        return Result.OK();
    }

    // 任何人都可以调用
    @PostMapping("/rebalance")
    public Result<Boolean> rebalance() {
        return Result.OK(weightAllocator.rebalance());
    }

    @PostMapping("/refreshAll")
    public Result<Void> refreshAll() {
        accumulatorEngine.refreshAll();
        return Result.OK();
    }

    @GetMapping("/votes")
    public Result<VoteRecord> getVotes(@RequestParam String participant) {
        return Result.OK(weightAllocator.getVotes(AccountAddress.fromHex(participant)));
    }

    @GetMapping("/totalWeight")
    public Result<BigInteger> totalWeight() {
        return Result.OK(weightAllocator.getTotalWeight());
    }
}

package com.bit.gauge.api;

import com.bit.gauge.pool.PoolRegistry;
import com.bit.gauge.result.Result;
import com.bit.gauge.reward.AccumulatorEngine;
import com.bit.gauge.structure.dto.RegisterPoolRequest;
import com.bit.gauge.structure.dto.ReleaseWeightRequest;
import com.bit.gauge.structure.dto.StartEmissionsRequest;
import com.bit.gauge.structure.emission.EmissionSchedule;
import com.bit.gauge.structure.pool.Pool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * 治理者接口，权限由 PermissionsAspect 校验
 */
@Slf4j
@RestController
@RequestMapping("/admin")
public class AdminApi {

    @Autowired
    private PoolRegistry poolRegistry;

    @Autowired
    private AccumulatorEngine accumulatorEngine;

    @PostMapping("/registerPool")
    public Result<Pool> registerPool(@RequestBody RegisterPoolRequest req) {
        return Result.OK(poolRegistry.registerPool(req.getCaller(), req.getStakedAsset(),
                req.getReservedWeight(), req.isRefreshFirst()));
    }

    @PostMapping("/releaseReservedWeight")
    public Result<Pool> releaseReservedWeight(@RequestBody ReleaseWeightRequest req) {
        return Result.OK(poolRegistry.releaseReservedWeight(req.getCaller(), req.getPoolId(), req.isRefreshFirst()));
    }

    @PostMapping("/startEmissions")
    public Result<EmissionSchedule> startEmissions(@RequestBody StartEmissionsRequest req) {
        return Result.OK(accumulatorEngine.startEmissions(req.getCaller(), req.getTotalSupply()));
    }

    @GetMapping("/emission")
    public Result<EmissionSchedule> emission() {
        return Result.OK(accumulatorEngine.getEmission());
    }
}

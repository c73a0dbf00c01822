package com.bit.gauge;

import com.bit.gauge.asset.memory.MemoryAssetLedger;
import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.event.GaugeEvent;
import com.bit.gauge.event.GaugeEventType;
import com.bit.gauge.event.RecentEventStore;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import com.bit.gauge.pool.PoolRegistry;
import com.bit.gauge.reward.AccumulatorEngine;
import com.bit.gauge.staking.PositionLedger;
import com.bit.gauge.structure.pool.Pool;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 完整容器：权限切面、事件监听、HTTP 接口
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
public class GaugeApplicationTest {

    @Autowired
    private SystemConfig config;

    @Autowired
    private PoolRegistry poolRegistry;

    @Autowired
    private PositionLedger positionLedger;

    @Autowired
    private AccumulatorEngine accumulatorEngine;

    @Autowired
    private MemoryAssetLedger ledger;

    @Autowired
    private RecentEventStore recentEventStore;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testAdminOperationsRequireGovernor() {
        AccountAddress stranger = AccountAddress.of(0xbad);
        GaugeException e = assertThrows(GaugeException.class,
                () -> poolRegistry.registerPool(stranger, AssetId.of(0x5001), BigInteger.TEN, true));
        assertEquals(ErrorType.PERMISSION_DENIED, e.getErrorType());
        assertNull(poolRegistry.poolIdOf(AssetId.of(0x5001)));

        assertEquals(ErrorType.PERMISSION_DENIED, assertThrows(GaugeException.class,
                () -> accumulatorEngine.startEmissions(stranger, BigInteger.TEN)).getErrorType());
        assertFalse(accumulatorEngine.getEmission().isStarted());

        Pool pool = poolRegistry.registerPool(config.governorAddress(), AssetId.of(0x5002), BigInteger.TEN, true);
        assertEquals(ErrorType.PERMISSION_DENIED, assertThrows(GaugeException.class,
                () -> poolRegistry.releaseReservedWeight(stranger, pool.getPoolId(), true)).getErrorType());
        assertEquals(BigInteger.TEN, poolRegistry.getPool(pool.getPoolId()).getReservedWeight());
    }

    @Test
    void testEventsAreRecorded() {
        AccountAddress alice = AccountAddress.of(0xa11ce);
        AssetId asset = AssetId.of(0x5003);
        Pool pool = poolRegistry.registerPool(config.governorAddress(), asset, BigInteger.ONE, true);
        ledger.mint(asset, alice, BigInteger.valueOf(100));
        positionLedger.deposit(alice, pool.getPoolId(), BigInteger.valueOf(100));

        List<GaugeEvent> recent = recentEventStore.recent(10);
        log.info("最近事件: {}", recent);
        assertTrue(recent.stream().anyMatch(event -> event.getType() == GaugeEventType.DEPOSIT
                && event.getParticipant().equals(alice)
                && event.getPoolId() == pool.getPoolId()
                && event.getAmount().equals(BigInteger.valueOf(100))));
    }

    @Test
    void testHttpPermissionDenied() throws Exception {
        String body = "{\"caller\":\"" + AccountAddress.of(0xbad).toHex() + "\","
                + "\"stakedAsset\":\"0x" + AssetId.of(0x5004).toHex() + "\",\"reservedWeight\":10}";
        mockMvc.perform(post("/admin/registerPool").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(ErrorType.PERMISSION_DENIED.getCode()));
    }

    @Test
    void testHttpRegisterAndQueryPool() throws Exception {
        String body = "{\"caller\":\"" + config.getGovernor() + "\","
                + "\"stakedAsset\":\"" + AssetId.of(0x5005).toHex() + "\",\"reservedWeight\":25}";
        mockMvc.perform(post("/admin/registerPool").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.stakedAsset").value(AssetId.of(0x5005).toHex()))
                .andExpect(jsonPath("$.data.reservedWeight").value(25));

        Long poolId = poolRegistry.poolIdOf(AssetId.of(0x5005));
        assertNotNull(poolId);
        mockMvc.perform(get("/gauge/pool").param("poolId", String.valueOf(poolId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.poolId").value(poolId));
    }

    @Test
    void testHttpValidationErrors() throws Exception {
        mockMvc.perform(get("/gauge/pool").param("poolId", "100000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorType.UNKNOWN_POOL.getCode()));
        mockMvc.perform(get("/gauge/pending").param("poolId", "0").param("participant", "0x12"))
                .andExpect(status().isBadRequest());
    }
}

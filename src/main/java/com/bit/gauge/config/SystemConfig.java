package com.bit.gauge.config;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.common.AssetId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 引擎配置，对应 application.yml 中的 gauge.* 配置项
 */
@Data
@Component
@ConfigurationProperties(prefix = "gauge")
public class SystemConfig {

    /**
     * 累加器定点精度（reward-per-share 放大倍数）
     */
    private long accumulatorScale = 1_000_000_000_000L;

    /**
     * 排放窗口（秒），默认一年
     */
    private long emissionWindowSeconds = 31_536_000L;

    /**
     * 派生质押中原始质押的占比（百分比），剩余部分按治理权力加成
     */
    private int boostBasePercent = 40;

    /**
     * 治理者地址：注册奖励池、释放预留权重、启动排放
     */
    private String governor = "0x0000000000000000000000000000000000000000000000000000000000000001";

    /**
     * 托管账户：持有全部质押资产与待分发的奖励资产
     */
    private String custody = "0x00000000000000000000000000000000000000000000000000000000000000ff";

    /**
     * 奖励资产
     */
    private String rewardAsset = "0x0000000000000000000000000000000000000000000000000000000000000100";

    /**
     * 近期事件缓存容量
     */
    private int eventCacheSize = 10_000;

    public BigInteger scale() {
        return BigInteger.valueOf(accumulatorScale);
    }

    public AccountAddress governorAddress() {
        return AccountAddress.fromHex(governor);
    }

    public AccountAddress custodyAddress() {
        return AccountAddress.fromHex(custody);
    }

    public AssetId rewardAssetId() {
        return AssetId.fromHex(rewardAsset);
    }
}

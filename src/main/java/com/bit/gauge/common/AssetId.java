package com.bit.gauge.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.EqualsAndHashCode;

/**
 * 资产标识：奖励资产、各池的质押资产
 */
@EqualsAndHashCode(callSuper = true)
public class AssetId extends ByteHash32 {

    private AssetId(byte[] value) {
        super(value);
    }

    public static AssetId fromBytes(byte[] bytes) {
        return new AssetId(bytes);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AssetId fromHex(String hex) {
        return new AssetId(hexToBytes(hex));
    }

    public static AssetId of(long n) {
        return new AssetId(leftPad(n));
    }
}

package com.bit.gauge.asset;

/**
 * 资产账本拒绝转账（余额不足、金额非法等）
 */
public class AssetTransferException extends RuntimeException {

    public AssetTransferException(String message) {
        super(message);
    }
}

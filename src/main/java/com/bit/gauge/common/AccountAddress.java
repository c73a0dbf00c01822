package com.bit.gauge.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.EqualsAndHashCode;

/**
 * 账户地址：参与者、托管账户、治理者均使用该类型
 */
@EqualsAndHashCode(callSuper = true)
public class AccountAddress extends ByteHash32 {
    public static final AccountAddress ZERO = new AccountAddress(new byte[HASH_LENGTH]);

    private AccountAddress(byte[] value) {
        super(value);
    }

    public static AccountAddress fromBytes(byte[] bytes) {
        return new AccountAddress(bytes);
    }

    /**
     * 从十六进制字符串创建地址
     * @param hex 64位十六进制字符串（可带0x前缀）
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AccountAddress fromHex(String hex) {
        return new AccountAddress(hexToBytes(hex));
    }

    /**
     * 以序号生成地址（大端补零），用于配置默认值和测试
     */
    public static AccountAddress of(long n) {
        return new AccountAddress(leftPad(n));
    }
}

package com.bit.gauge.common;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * 32字节标识的通用基类，封装共同逻辑（长度校验、不可变性、十六进制转换等）
 * 具体标识类型（如参与者地址、资产标识）应继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable {
    public static final int HASH_LENGTH = 32;

    // 存储32字节原始数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节原始数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH);
        this.hexValue = Hex.encodeHexString(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 转换为十六进制字符串（使用缓存值）
     */
    @JsonValue
    public String toHex() {
        return hexValue;
    }

    /**
     * 判断是否为零值（全0字节）
     */
    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return hexValue;
    }

    /**
     * 十六进制字符串转字节数组，允许0x前缀，大小写均可
     */
    protected static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        String body = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (body.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException("Invalid hex string length for 32-byte hash: " + hex);
        }
        try {
            return Hex.decodeHex(body);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex character in: " + hex, e);
        }
    }

    /**
     * 非负整数按大端左侧补零为32字节
     */
    protected static byte[] leftPad(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative value cannot be encoded: " + n);
        }
        byte[] trimmed = BigInteger.valueOf(n).toByteArray();
        byte[] b = new byte[HASH_LENGTH];
        int length = Math.min(trimmed.length, HASH_LENGTH);
        System.arraycopy(trimmed, trimmed.length - length, b, HASH_LENGTH - length, length);
        return b;
    }
}

package com.bit.gauge.exception;

public enum ErrorType {
    INVALID_AMOUNT(4001, "金额非法（必须为正数）"),
    INSUFFICIENT_STAKE(4002, "质押余额不足"),
    UNKNOWN_POOL(4003, "奖励池不存在"),
    POOL_ALREADY_REGISTERED(4004, "该质押资产已注册奖励池"),
    INVALID_POOL_ASSET(4005, "质押资产非法（不能为奖励资产）"),
    RESERVED_WEIGHT_RELEASED(4006, "预留权重已释放或不存在"),
    EMISSIONS_ALREADY_STARTED(4007, "排放已启动，只能启动一次"),
    VOTE_LENGTH_MISMATCH(4008, "投票池数量与权重数量不一致"),
    VOTE_WEIGHT_ZERO(4009, "投票权重之和为零"),
    INVALID_VOTE_WEIGHT(4010, "投票权重非法（不能为负数）"),
    DUPLICATE_VOTE_POOL(4011, "同一次投票中奖励池重复"),
    INVALID_PARTICIPANT(4012, "参与者非法（不能为空或托管账户）"),
    TRANSFER_FAILED(5001, "资产转账失败（余额不足或被拒绝）"),
    ROLLBACK_FAILED(5002, "回滚补偿转账失败"),
    PERMISSION_DENIED(5101, "无权限执行该操作");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}

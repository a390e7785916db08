package com.bit.politeia.exception;

public enum ErrorType {
    MALFORMED_REQUEST("请求格式错误（无法解码的负载）", false),
    MALFORMED_TOKEN("提案令牌格式错误", false),
    INVALID_ADDRESS("地址无效（格式错误或非P2PKH地址）", false),
    INVALID_SIGNATURE("签名无效（Base64/Hex 编码错误）", false),
    ORACLE_UNAVAILABLE("区块数据服务不可用（网络或解码失败）", false),
    CHAIN_TOO_YOUNG("链高度不足以生成安全快照", false),
    BACKEND_BUSY("后端繁忙，获取写锁超时，请稍后重试", true),
    SHUTDOWN_IN_PROGRESS("后端正在关闭", true),
    LEDGER_CORRUPT("投票账本已损坏", false),
    LEDGER_IO("投票账本读写失败", false),
    VOTE_ALREADY_STARTED("该提案投票已开始", false),
    RECORD_NOT_FOUND("提案记录不存在", false),
    PLUGIN_NOT_FOUND("插件不存在", false),
    COMMAND_NOT_FOUND("插件命令不存在", false),
    IDENTITY_UNAVAILABLE("服务签名身份不可用", false);

    private final String desc;

    // 可重试错误：调用方应退避后重试
    private final boolean retryable;

    ErrorType(String desc, boolean retryable) {
        this.desc = desc;
        this.retryable = retryable;
    }

    public String getDesc() {
        return desc;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

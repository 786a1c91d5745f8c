package com.contractmind.types.enums;

/**
 * 目标合约类型。
 */
public enum ContractTypeEnum {
    /** 暴露了非零 trustedHub() 的合约 */
    HUB_AWARE,
    /** 其它合约，包括探测失败的情况 */
    REGULAR
}

package com.contractmind.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义系统中使用的全局常量，如分隔符、地址前缀等通用配置。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 十六进制前缀 */
    public final static String HEX_PREFIX = "0x";

    /** 账户地址格式：0x + 40 位十六进制 */
    public final static String ADDRESS_REGEX = "^0x[0-9a-fA-F]{40}$";

    /** 零地址 */
    public final static String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    /** 交易 value，本系统所有交易均不附带原生代币 */
    public final static String ZERO_VALUE = "0x0";

}

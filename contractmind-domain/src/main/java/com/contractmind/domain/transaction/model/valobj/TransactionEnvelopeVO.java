package com.contractmind.domain.transaction.model.valobj;

import com.contractmind.types.enums.RouteTypeEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 未签名交易信封。
 * <p>
 * route=HUB 时 to 为 Hub 地址，否则为目标合约地址；value 恒为 0。
 * 构造后不可变，调用方负责签名与广播。
 * </p>
 */
@Getter
@ToString
@Builder
public class TransactionEnvelopeVO {

    private final String to;

    private final String data;

    private final String value;

    private final BigInteger gas;

    /**
     * 获取失败时为 null，由钱包使用默认值
     */
    private final BigInteger gasPrice;

    private final BigInteger nonce;

    private final RouteTypeEnum route;

    private final String functionName;

    private final String description;

    private final TransactionPreviewVO preview;
}

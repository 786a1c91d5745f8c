package com.contractmind.domain.transaction.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.transaction.model.valobj.CoercionSettingsVO;
import com.contractmind.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 参数归一化领域服务。
 * <p>
 * 纯函数，不抛异常：
 * <ul>
 *   <li>address：第一人称占位符或非 0x 开头的值替换为调用者地址</li>
 *   <li>uint256：数字或数字字符串按代币精度放大为整数（默认 10^18）</li>
 *   <li>其它类型原样透传</li>
 * </ul>
 * 无法换算的值保持原样并记录 warn 日志，坏输入可能因此被静默放过。
 * 调用方必须保证每个参数在一次请求中只换算一次，重复换算会再放大 10^decimals 倍。
 * </p>
 */
@Slf4j
@Service
public class ParameterCoercionDomainService {

    private static final Set<String> SELF_REFERENCES = Set.of("user", "me", "my", "myself", "sender");
    private static final String AMOUNT_TYPE = "uint256";
    /** uint256 最大值的十进制位数 */
    private static final int MAX_AMOUNT_DIGITS = 78;

    public Map<String, Object> coerce(Map<String, Object> params, List<AbiParameterVO> inputs, String callerAddress) {
        return coerce(params, inputs, callerAddress, CoercionSettingsVO.DEFAULT_TOKEN_DECIMALS);
    }

    public Map<String, Object> coerce(Map<String, Object> params,
                                      List<AbiParameterVO> inputs,
                                      String callerAddress,
                                      int decimals) {
        Map<String, Object> result = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        if (inputs == null || inputs.isEmpty() || result.isEmpty()) {
            return result;
        }
        for (AbiParameterVO input : inputs) {
            if (input == null || input.getName() == null || !result.containsKey(input.getName())) {
                continue;
            }
            Object value = result.get(input.getName());
            if (value == null) {
                continue;
            }
            if ("address".equals(input.getType())) {
                result.put(input.getName(), coerceAddress(input.getName(), value, callerAddress));
            } else if (AMOUNT_TYPE.equals(input.getType())) {
                result.put(input.getName(), scaleAmount(input.getName(), value, decimals));
            }
        }
        return result;
    }

    /**
     * 将十进制代币数量放大为最小单位整数；无法换算时返回原值。
     */
    public Object scaleAmount(String name, Object value, int decimals) {
        BigDecimal amount = toDecimal(value);
        if (amount == null) {
            log.warn("AMOUNT_COERCION_SKIPPED param={}, value={}, reason=not numeric", name, value);
            return value;
        }
        if ((long) amount.precision() - amount.scale() + decimals > MAX_AMOUNT_DIGITS) {
            log.warn("AMOUNT_COERCION_SKIPPED param={}, value={}, reason=exceeds uint256", name, value);
            return value;
        }
        BigInteger scaled;
        try {
            scaled = amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigInteger();
        } catch (ArithmeticException ex) {
            log.warn("AMOUNT_COERCION_SKIPPED param={}, value={}, reason={}", name, value, ex.getMessage());
            return value;
        }
        log.debug("AMOUNT_COERCED param={}, value={}, decimals={}, scaled={}", name, value, decimals, scaled);
        return scaled;
    }

    private Object coerceAddress(String name, Object value, String callerAddress) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        if (SELF_REFERENCES.contains(trimmed.toLowerCase(Locale.ROOT))
                || !trimmed.startsWith(Constants.HEX_PREFIX)) {
            log.debug("ADDRESS_PLACEHOLDER_REPLACED param={}, value={}", name, text);
            return callerAddress;
        }
        return text;
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (value instanceof String text) {
            String trimmed = text.trim().replace(",", "").replace("_", "");
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}

package com.contractmind.domain.transaction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * 金额精度配置。
 * <p>
 * 查找顺序：代币符号 → 函数名 → 默认精度（18）。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoercionSettingsVO {

    public static final int DEFAULT_TOKEN_DECIMALS = 18;

    @Builder.Default
    private Integer defaultDecimals = DEFAULT_TOKEN_DECIMALS;

    /**
     * 代币符号（大写）→ 精度
     */
    @Builder.Default
    private Map<String, Integer> tokenDecimals = Collections.emptyMap();

    /**
     * 函数名 → 精度
     */
    @Builder.Default
    private Map<String, Integer> functionDecimals = Collections.emptyMap();

    public static CoercionSettingsVO defaults() {
        return CoercionSettingsVO.builder().build();
    }

    public int resolveDecimals(String functionName, String token) {
        if (token != null && tokenDecimals != null) {
            Integer byToken = tokenDecimals.get(token.trim().toUpperCase(Locale.ROOT));
            if (byToken != null) {
                return byToken;
            }
        }
        if (functionName != null && functionDecimals != null) {
            Integer byFunction = functionDecimals.get(functionName);
            if (byFunction != null) {
                return byFunction;
            }
        }
        return defaultDecimals == null ? DEFAULT_TOKEN_DECIMALS : defaultDecimals;
    }
}

package com.contractmind.domain.intent.model.valobj;

import com.contractmind.types.enums.IntentSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析后的用户意图，每条消息构建一次，不单独持久化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedIntentVO {

    /**
     * 目标函数名，未命中或被拒绝时为 null
     */
    private String functionName;

    private boolean requiresTransaction;

    private boolean needsMoreInfo;

    /**
     * 归一化后的参数
     */
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    /**
     * 解析得到的原始参数
     */
    @Builder.Default
    private Map<String, Object> rawParams = new LinkedHashMap<>();

    @Builder.Default
    private List<String> missingParams = new ArrayList<>();

    /**
     * 回复给用户的文本
     */
    private String response;

    /**
     * 置信度 [0,1]
     */
    private double confidence;

    private IntentSourceEnum source;

    /**
     * 金额提示（未换算）
     */
    private String amount;

    /**
     * 代币符号提示
     */
    private String token;

    public boolean hasFunction() {
        return functionName != null;
    }

    /**
     * 拒绝当前函数：清空函数名与参数，仅保留回复文本。
     */
    public void reject(String reason) {
        this.functionName = null;
        this.requiresTransaction = false;
        this.needsMoreInfo = false;
        this.params = new LinkedHashMap<>();
        this.rawParams = new LinkedHashMap<>();
        this.missingParams = new ArrayList<>();
        this.response = reason;
    }
}

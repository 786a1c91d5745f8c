package com.contractmind.domain.intent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 大模型解析参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentParserSettingsVO {

    @Builder.Default
    private Double temperature = 0.7D;

    @Builder.Default
    private Integer maxTokens = 2000;

    /**
     * 写入提示词的最近对话条数
     */
    @Builder.Default
    private Integer historyWindow = 4;

    public static IntentParserSettingsVO defaults() {
        return IntentParserSettingsVO.builder().build();
    }
}

package com.contractmind.domain.intent.model.valobj;

import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 一次意图解析的输入。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentParseContextVO {

    private String message;

    private String userAddress;

    private String agentName;

    private FunctionCatalogVO catalog;

    /**
     * 最近的对话轮次，时间正序
     */
    @Builder.Default
    private List<ChatTurnEntity> recentTurns = Collections.emptyList();

    public FunctionCatalogVO safeCatalog() {
        return catalog == null ? FunctionCatalogVO.empty() : catalog;
    }
}

package com.contractmind.domain.intent.service;

import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;

/**
 * 意图解析策略。
 * <p>
 * 实现只负责从文本中抽取函数名与原始参数，目录校验与参数归一化由 IntentParseDomainService 统一完成。
 * </p>
 */
public interface IIntentParser {

    ParsedIntentVO parse(IntentParseContextVO context);
}

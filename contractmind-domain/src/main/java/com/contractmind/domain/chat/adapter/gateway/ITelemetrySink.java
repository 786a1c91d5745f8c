package com.contractmind.domain.chat.adapter.gateway;

import com.contractmind.domain.chat.model.valobj.TelemetryPublishResultVO;
import com.contractmind.types.enums.TelemetrySchemaEnum;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 遥测事件出口，异步投递，失败只记录日志。
 */
public interface ITelemetrySink {

    CompletableFuture<TelemetryPublishResultVO> publish(TelemetrySchemaEnum schema, Map<String, Object> record);
}

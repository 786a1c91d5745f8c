package com.contractmind.infrastructure.gateway.telemetry;

import com.contractmind.domain.chat.adapter.gateway.ITelemetrySink;
import com.contractmind.domain.chat.model.valobj.TelemetryPublishResultVO;
import com.contractmind.infrastructure.util.JsonCodec;
import com.contractmind.types.enums.TelemetrySchemaEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 遥测事件投递。
 * <p>
 * 事件以 JSON 写入 telemetry 日志，recordId 为内容的 keccak-256。未启用时直接返回失败结果。
 * </p>
 */
@Slf4j
@Component
public class StreamsTelemetrySink implements ITelemetrySink {

    private final JsonCodec jsonCodec;
    private final Executor executor;
    private final boolean enabled;

    public StreamsTelemetrySink(JsonCodec jsonCodec,
                                @Qualifier("commonThreadPoolExecutor") Executor executor,
                                @Value("${contractmind.streams.enabled:false}") boolean enabled) {
        this.jsonCodec = jsonCodec;
        this.executor = executor;
        this.enabled = enabled;
    }

    @Override
    public CompletableFuture<TelemetryPublishResultVO> publish(TelemetrySchemaEnum schema, Map<String, Object> record) {
        if (!enabled) {
            return CompletableFuture.completedFuture(TelemetryPublishResultVO.failed("telemetry disabled"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> write(schema, record), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("TELEMETRY_REJECTED schema={}, error={}", schema.getCode(), ex.getMessage());
            return CompletableFuture.completedFuture(TelemetryPublishResultVO.failed(ex.getMessage()));
        }
    }

    private TelemetryPublishResultVO write(TelemetrySchemaEnum schema, Map<String, Object> record) {
        try {
            String payload = jsonCodec.writeValue(record);
            String recordId = Hash.sha3String(schema.getCode() + ":" + payload);
            log.info("TELEMETRY_PUBLISHED schema={}, recordId={}, bytes={}",
                    schema.getCode(), recordId, payload == null ? 0 : payload.getBytes(StandardCharsets.UTF_8).length);
            return TelemetryPublishResultVO.ok(recordId);
        } catch (Exception ex) {
            log.warn("TELEMETRY_PUBLISH_FAILED schema={}, error={}", schema.getCode(), ex.getMessage());
            return TelemetryPublishResultVO.failed(ex.getMessage());
        }
    }
}

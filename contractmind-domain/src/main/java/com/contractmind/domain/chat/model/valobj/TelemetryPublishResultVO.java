package com.contractmind.domain.chat.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 遥测投递结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryPublishResultVO {

    private boolean success;

    private String recordId;

    private String error;

    public static TelemetryPublishResultVO ok(String recordId) {
        return new TelemetryPublishResultVO(true, recordId, null);
    }

    public static TelemetryPublishResultVO failed(String error) {
        return new TelemetryPublishResultVO(false, null, error);
    }
}

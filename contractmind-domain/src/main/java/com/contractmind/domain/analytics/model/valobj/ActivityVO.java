package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户最近一笔交易活动。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityVO {

    private String action;

    private String protocol;

    private LocalDateTime timestamp;

    private boolean success;
}

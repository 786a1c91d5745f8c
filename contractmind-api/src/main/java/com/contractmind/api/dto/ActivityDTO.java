package com.contractmind.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 最近交易活动 DTO
 */
@Data
public class ActivityDTO {

    private String action;
    private String protocol;
    private LocalDateTime timestamp;
    private Boolean success;
}

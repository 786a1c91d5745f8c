package com.contractmind.api.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Agent 详情 DTO，附带解析后的函数目录。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class AgentDetailDTO extends AgentSummaryDTO {

    private String configIpfs;
    private List<AbiFunctionDTO> functions;
}

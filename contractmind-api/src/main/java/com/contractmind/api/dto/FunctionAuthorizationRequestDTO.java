package com.contractmind.api.dto;

import lombok.Data;

/**
 * 函数授权/撤销请求 DTO
 */
@Data
public class FunctionAuthorizationRequestDTO {

    private String functionName;
}

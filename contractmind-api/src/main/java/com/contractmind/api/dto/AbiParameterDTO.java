package com.contractmind.api.dto;

import lombok.Data;

/**
 * ABI 参数 DTO。
 */
@Data
public class AbiParameterDTO {

    private String name;
    private String type;
}

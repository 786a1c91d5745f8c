package com.contractmind.api.dto;

import lombok.Data;

import java.util.List;

/**
 * ABI 函数 DTO。
 */
@Data
public class AbiFunctionDTO {

    private String name;
    private String signature;
    private String selector;
    private List<AbiParameterDTO> inputs;
    private List<AbiParameterDTO> outputs;
    private String stateMutability;
    private Boolean authorized;
}

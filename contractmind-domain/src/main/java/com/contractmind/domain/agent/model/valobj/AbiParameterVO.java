package com.contractmind.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ABI 参数（名称 + Solidity 类型）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AbiParameterVO {

    private String name;

    /**
     * 规范化后的 Solidity 类型，如 uint256、address[]、bytes32
     */
    private String type;

    public static AbiParameterVO of(String name, String type) {
        return new AbiParameterVO(name, type);
    }
}

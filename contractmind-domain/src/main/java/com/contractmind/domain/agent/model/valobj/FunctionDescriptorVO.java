package com.contractmind.domain.agent.model.valobj;

import com.contractmind.types.enums.StateMutabilityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 类型化的 ABI 函数描述。
 * <p>
 * 名称 + 输入类型元组唯一确定链上 selector（规范签名 keccak-256 的前 4 字节）。
 * 归属于所在 Agent，ABI 或授权表变化时重新计算。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionDescriptorVO {

    private String name;

    private List<AbiParameterVO> inputs;

    private List<AbiParameterVO> outputs;

    private StateMutabilityEnum stateMutability;

    private boolean authorized;

    public static FunctionDescriptorVO of(String name,
                                          List<AbiParameterVO> inputs,
                                          List<AbiParameterVO> outputs,
                                          StateMutabilityEnum stateMutability) {
        return new FunctionDescriptorVO(name, inputs, outputs, stateMutability, true);
    }

    /**
     * 规范签名，如 {@code transfer(address,uint256)}。
     */
    public String getSignature() {
        String types = safeInputs().stream()
                .map(AbiParameterVO::getType)
                .collect(Collectors.joining(","));
        return name + "(" + types + ")";
    }

    public boolean isReadOnly() {
        return stateMutability != null && stateMutability.isReadOnly();
    }

    public List<AbiParameterVO> safeInputs() {
        return inputs == null ? Collections.emptyList() : inputs;
    }

    public List<AbiParameterVO> safeOutputs() {
        return outputs == null ? Collections.emptyList() : outputs;
    }
}

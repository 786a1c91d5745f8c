package com.contractmind.domain.agent.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.types.enums.StateMutabilityEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ABI 函数目录领域服务：把原始 JSON ABI 解析为类型化函数描述。
 * <p>
 * 只保留 type=function 的条目（缺省 type 视为 function）；授权位来自授权表，缺省为未授权。
 * </p>
 */
@Slf4j
@Service
public class AbiFunctionCatalogDomainService {

    public FunctionCatalogVO parse(List<Map<String, Object>> abi, Map<String, Boolean> authorizations) {
        if (abi == null || abi.isEmpty()) {
            return FunctionCatalogVO.empty();
        }
        Map<String, Boolean> auth = authorizations == null ? Collections.emptyMap() : authorizations;
        List<FunctionDescriptorVO> functions = new ArrayList<>();
        for (Map<String, Object> item : abi) {
            if (item == null || !isFunction(item)) {
                continue;
            }
            String name = getString(item, "name");
            if (StringUtils.isBlank(name)) {
                continue;
            }
            FunctionDescriptorVO descriptor = new FunctionDescriptorVO();
            descriptor.setName(name);
            descriptor.setInputs(parseParameters(item.get("inputs")));
            descriptor.setOutputs(parseParameters(item.get("outputs")));
            descriptor.setStateMutability(resolveMutability(item));
            descriptor.setAuthorized(Boolean.TRUE.equals(auth.get(name)));
            functions.add(descriptor);
        }
        return new FunctionCatalogVO(functions);
    }

    /**
     * 规范化 Solidity 类型别名：uint → uint256，int → int256（含数组后缀）。
     */
    public static String normalizeType(String type) {
        if (type == null) {
            return null;
        }
        String trimmed = type.trim();
        int bracket = trimmed.indexOf('[');
        String base = bracket >= 0 ? trimmed.substring(0, bracket) : trimmed;
        String suffix = bracket >= 0 ? trimmed.substring(bracket) : "";
        return switch (base) {
            case "uint" -> "uint256" + suffix;
            case "int" -> "int256" + suffix;
            default -> trimmed;
        };
    }

    private boolean isFunction(Map<String, Object> item) {
        String type = getString(item, "type");
        return StringUtils.isBlank(type) || "function".equals(type.trim().toLowerCase(Locale.ROOT));
    }

    private StateMutabilityEnum resolveMutability(Map<String, Object> item) {
        String mutability = getString(item, "stateMutability");
        if (StringUtils.isNotBlank(mutability)) {
            try {
                return StateMutabilityEnum.fromCode(mutability);
            } catch (IllegalArgumentException ex) {
                // 未知取值按写操作处理，执行前仍需授权
                log.warn("ABI_MUTABILITY_UNKNOWN function={}, stateMutability={}, fallback=nonpayable",
                        getString(item, "name"), mutability);
                return StateMutabilityEnum.NONPAYABLE;
            }
        }
        // 旧版 ABI 使用 constant/payable 标记
        if (Boolean.TRUE.equals(item.get("constant"))) {
            return StateMutabilityEnum.VIEW;
        }
        if (Boolean.TRUE.equals(item.get("payable"))) {
            return StateMutabilityEnum.PAYABLE;
        }
        return StateMutabilityEnum.NONPAYABLE;
    }

    private List<AbiParameterVO> parseParameters(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            return Collections.emptyList();
        }
        List<AbiParameterVO> parameters = new ArrayList<>();
        int index = 0;
        for (Object element : list) {
            if (element instanceof Map<?, ?> map) {
                Object name = map.get("name");
                Object type = map.get("type");
                String paramName = name == null || StringUtils.isBlank(String.valueOf(name)) ? "arg" + index : String.valueOf(name);
                parameters.add(AbiParameterVO.of(paramName, normalizeType(type == null ? null : String.valueOf(type))));
            }
            index++;
        }
        return parameters;
    }

    private String getString(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value == null ? null : String.valueOf(value);
    }
}

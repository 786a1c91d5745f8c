package com.contractmind.domain.agent.model.valobj;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent 函数目录：保持 ABI 顺序，并提供名称 → 描述的查找表。
 * <p>
 * 同名重载只保留 ABI 中出现的第一个。
 * </p>
 */
public class FunctionCatalogVO {

    private static final FunctionCatalogVO EMPTY = new FunctionCatalogVO(Collections.emptyList());

    private final List<FunctionDescriptorVO> functions;
    private final Map<String, FunctionDescriptorVO> byName;

    public FunctionCatalogVO(List<FunctionDescriptorVO> functions) {
        this.functions = functions == null ? Collections.emptyList() : List.copyOf(functions);
        Map<String, FunctionDescriptorVO> index = new LinkedHashMap<>();
        for (FunctionDescriptorVO function : this.functions) {
            index.putIfAbsent(function.getName(), function);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public static FunctionCatalogVO empty() {
        return EMPTY;
    }

    public List<FunctionDescriptorVO> getFunctions() {
        return functions;
    }

    public FunctionDescriptorVO find(String name) {
        return name == null ? null : byName.get(name);
    }

    /**
     * 忽略大小写查找，关键词兜底解析使用。
     */
    public FunctionDescriptorVO findIgnoreCase(String name) {
        if (name == null) {
            return null;
        }
        FunctionDescriptorVO exact = byName.get(name);
        if (exact != null) {
            return exact;
        }
        for (FunctionDescriptorVO function : functions) {
            if (function.getName().equalsIgnoreCase(name)) {
                return function;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    public int size() {
        return functions.size();
    }
}

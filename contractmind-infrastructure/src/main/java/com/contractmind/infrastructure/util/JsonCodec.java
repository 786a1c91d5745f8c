package com.contractmind.infrastructure.util;

import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSON 编解码工具，ABI 列与模型输出共用。
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<Map<String, Object>>> MAP_LIST_REF = new TypeReference<List<Map<String, Object>>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 对象。
     */
    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    /**
     * 读取 JSON 对象数组，ABI 的存储格式。
     */
    public List<Map<String, Object>> readMapList(String json) {
        return readValue(json, MAP_LIST_REF);
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to parse json", ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json", ex);
        }
    }
}

package com.contractmind.domain.transaction.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.AbiTypes;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Array;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.BytesType;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.NumericType;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Calldata 编码领域服务。
 * <p>
 * selector 为规范签名 {@code name(type1,type2,...)} UTF-8 字节 keccak-256 的前 4 字节，
 * 参数按标准 ABI 静态/动态编码规则拼接在其后。整次调用一次性编码。
 * 参数数量不符、值无法转换为声明类型或类型不受支持时抛出 ABI_ENCODING_ERROR。
 * </p>
 */
@Service
public class CalldataEncoderDomainService {

    private static final String STATIC_ARRAY_CLASS_PREFIX = "org.web3j.abi.datatypes.generated.StaticArray";

    /**
     * 计算函数 selector（0x + 8 位十六进制）。
     */
    public String selector(FunctionDescriptorVO function) {
        return selectorOf(function.getSignature());
    }

    public static String selectorOf(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }

    /**
     * 按 ABI 输入顺序编码。
     */
    public String encode(FunctionDescriptorVO function, List<?> orderedArgs) {
        if (function == null) {
            throw encodingError("Function descriptor is required", null);
        }
        List<AbiParameterVO> inputs = function.safeInputs();
        List<?> args = orderedArgs == null ? Collections.emptyList() : orderedArgs;
        if (args.size() != inputs.size()) {
            throw encodingError("Argument count mismatch for " + function.getSignature()
                    + ": expected " + inputs.size() + ", got " + args.size(), null);
        }
        List<Type> values = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            AbiParameterVO input = inputs.get(i);
            try {
                values.add(toAbiValue(input.getType(), args.get(i)));
            } catch (AppException ex) {
                throw encodingError("Invalid value for parameter '" + input.getName() + "': " + ex.getInfo(), ex);
            }
        }
        return selector(function) + FunctionEncoder.encodeConstructor(values);
    }

    /**
     * 按参数名取值后编码，缺失的参数视为编码错误。
     */
    public String encodeByName(FunctionDescriptorVO function, Map<String, Object> params) {
        List<Object> ordered = new ArrayList<>();
        for (AbiParameterVO input : function.safeInputs()) {
            if (params == null || params.get(input.getName()) == null) {
                throw encodingError("Missing required parameter: " + input.getName(), null);
            }
            ordered.add(params.get(input.getName()));
        }
        return encode(function, ordered);
    }

    /**
     * 解码 calldata 中 selector 之后的参数部分。
     */
    public List<Object> decodeArguments(FunctionDescriptorVO function, String calldata) {
        String clean = Numeric.cleanHexPrefix(calldata);
        if (clean.length() < 8) {
            throw encodingError("Calldata is shorter than a selector", null);
        }
        String expected = Numeric.cleanHexPrefix(selector(function));
        if (!clean.substring(0, 8).equalsIgnoreCase(expected)) {
            throw encodingError("Selector mismatch, expected 0x" + expected, null);
        }
        return decodeValues(clean.substring(8), function.safeInputs());
    }

    /**
     * 按参数类型解码 ABI 编码的元组（eth_call 返回值或参数区）。
     */
    public List<Object> decodeValues(String encoded, List<AbiParameterVO> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return Collections.emptyList();
        }
        List<TypeReference<Type>> references = new ArrayList<>(parameters.size());
        for (AbiParameterVO parameter : parameters) {
            references.add(typeReference(parameter.getType()));
        }
        List<Type> decoded = FunctionReturnDecoder.decode(encoded, references);
        List<Object> values = new ArrayList<>(decoded.size());
        for (Type type : decoded) {
            values.add(toJavaValue(type));
        }
        return values;
    }

    /**
     * Agent 标识转 bytes32：0x 开头按十六进制解析，否则取 UTF-8 字节；右侧补零并截断到 32 字节。
     */
    public static byte[] toBytes32(String agentId) {
        byte[] raw;
        if (agentId != null && agentId.startsWith(Constants.HEX_PREFIX) && isHex(agentId.substring(2))) {
            raw = Numeric.hexStringToByteArray(agentId);
        } else {
            raw = (agentId == null ? "" : agentId).getBytes(StandardCharsets.UTF_8);
        }
        return Arrays.copyOf(raw, 32);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    Type toAbiValue(String type, Object value) {
        if (type == null || type.isBlank()) {
            throw encodingError("Parameter type is missing", null);
        }
        if (value == null) {
            throw encodingError("Value is null for type " + type, null);
        }
        String normalized = type.trim();
        if (normalized.endsWith("]")) {
            return toArray(normalized, value);
        }
        if ("address".equals(normalized)) {
            if (!(value instanceof String text) || !text.trim().matches(Constants.ADDRESS_REGEX)) {
                throw encodingError("Cannot convert value '" + value + "' to address", null);
            }
            return new Address(text.trim());
        }
        if ("bool".equals(normalized)) {
            return new Bool(toBoolean(value));
        }
        if ("string".equals(normalized)) {
            return new Utf8String(String.valueOf(value));
        }
        if ("bytes".equals(normalized)) {
            return new DynamicBytes(toBytes(value, normalized));
        }
        if (normalized.startsWith("bytes")) {
            int size = parseSize(normalized, "bytes", 32);
            byte[] bytes = toBytes(value, normalized);
            if (bytes.length > size) {
                throw encodingError("Value is longer than " + normalized, null);
            }
            return instantiate(normalized, byte[].class, Arrays.copyOf(bytes, size));
        }
        if (normalized.startsWith("uint") || normalized.startsWith("int")) {
            return instantiate(normalized, BigInteger.class, toBigInteger(value, normalized));
        }
        throw encodingError("Unsupported ABI type: " + normalized, null);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Type toArray(String type, Object value) {
        int open = type.lastIndexOf('[');
        String componentType = type.substring(0, open);
        String lengthText = type.substring(open + 1, type.length() - 1);
        List<?> items = toList(value, type);
        List<Type> elements = new ArrayList<>(items.size());
        for (Object item : items) {
            elements.add(toAbiValue(componentType, item));
        }
        Class elementClass = elementClass(componentType, elements);
        if (lengthText.isEmpty()) {
            return new DynamicArray(elementClass, elements);
        }
        int length;
        try {
            length = Integer.parseInt(lengthText);
        } catch (NumberFormatException ex) {
            throw encodingError("Invalid array length in type " + type, ex);
        }
        if (length != elements.size()) {
            throw encodingError("Expected " + length + " elements for " + type + ", got " + elements.size(), null);
        }
        try {
            Class<?> arrayClass = Class.forName(STATIC_ARRAY_CLASS_PREFIX + length);
            return (Type) arrayClass.getConstructor(Class.class, List.class).newInstance(elementClass, elements);
        } catch (ReflectiveOperationException | RuntimeException ex) {
            throw encodingError("Cannot build " + type + ": " + rootMessage(ex), ex);
        }
    }

    @SuppressWarnings("rawtypes")
    private Class elementClass(String componentType, List<Type> elements) {
        if (!elements.isEmpty()) {
            return elements.get(0).getClass();
        }
        if (componentType.endsWith("]")) {
            return DynamicArray.class;
        }
        try {
            return AbiTypes.getType(componentType);
        } catch (RuntimeException ex) {
            throw encodingError("Unsupported ABI type: " + componentType, ex);
        }
    }

    private Type instantiate(String type, Class<?> argumentClass, Object argument) {
        try {
            Class<? extends Type> typeClass = AbiTypes.getType(type);
            return typeClass.getConstructor(argumentClass).newInstance(argument);
        } catch (ReflectiveOperationException ex) {
            throw encodingError("Cannot convert value '" + argument + "' to " + type + ": " + rootMessage(ex), ex);
        } catch (RuntimeException ex) {
            throw encodingError("Unsupported ABI type: " + type, ex);
        }
    }

    private BigInteger toBigInteger(Object value, String type) {
        try {
            if (value instanceof BigInteger integer) {
                return integer;
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return BigInteger.valueOf(((Number) value).longValue());
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).toBigIntegerExact();
            }
            if (value instanceof String text) {
                String trimmed = text.trim();
                if (trimmed.startsWith(Constants.HEX_PREFIX)) {
                    return Numeric.toBigInt(trimmed);
                }
                return new BigDecimal(trimmed).toBigIntegerExact();
            }
        } catch (ArithmeticException | NumberFormatException ex) {
            throw encodingError("Cannot convert value '" + value + "' to " + type, ex);
        }
        throw encodingError("Cannot convert value '" + value + "' to " + type, null);
    }

    private boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw encodingError("Cannot convert value '" + value + "' to bool", null);
    }

    private byte[] toBytes(Object value, String type) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof String text && text.startsWith(Constants.HEX_PREFIX) && isHex(text.substring(2))) {
            return Numeric.hexStringToByteArray(text);
        }
        throw encodingError("Cannot convert value '" + value + "' to " + type, null);
    }

    private List<?> toList(Object value, String type) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        throw encodingError("Cannot convert value '" + value + "' to " + type, null);
    }

    private int parseSize(String type, String prefix, int max) {
        try {
            int size = Integer.parseInt(type.substring(prefix.length()));
            if (size <= 0 || size > max) {
                throw encodingError("Unsupported ABI type: " + type, null);
            }
            return size;
        } catch (NumberFormatException ex) {
            throw encodingError("Unsupported ABI type: " + type, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private TypeReference<Type> typeReference(String type) {
        try {
            return (TypeReference<Type>) TypeReference.makeTypeReference(type);
        } catch (ClassNotFoundException | RuntimeException ex) {
            throw encodingError("Unsupported ABI type: " + type, ex);
        }
    }

    private Object toJavaValue(Type type) {
        if (type instanceof Array<?> array) {
            List<Object> items = new ArrayList<>();
            for (Type item : array.getValue()) {
                items.add(toJavaValue(item));
            }
            return items;
        }
        if (type instanceof BytesType bytesType) {
            return Numeric.toHexString(bytesType.getValue());
        }
        if (type instanceof NumericType numericType) {
            return numericType.getValue();
        }
        if (type instanceof Address address) {
            return address.getValue();
        }
        return type.getValue();
    }

    private static boolean isHex(String text) {
        return text.isEmpty() || text.matches("[0-9a-fA-F]+") && text.length() % 2 == 0;
    }

    private String rootMessage(Throwable ex) {
        Throwable cursor = ex;
        while (cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor.getMessage() == null ? cursor.getClass().getSimpleName() : cursor.getMessage();
    }

    private AppException encodingError(String message, Throwable cause) {
        return new AppException(ResponseCode.ABI_ENCODING_ERROR, message, cause);
    }
}

package com.contractmind.api.response;

import com.contractmind.types.enums.ResponseCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有 REST 接口均返回该结构，HTTP 状态码恒为 200，业务结果由 {@code code} 区分：
 * "0000" 为成功，"0004" 表示 Agent 或函数不存在。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author getoffer
 * @since 2025-10-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = -2419081427160213475L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

    public static <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    public static <T> Response<T> fail(ResponseCode responseCode, String info) {
        return Response.<T>builder()
                .code(responseCode.getCode())
                .info(info == null ? responseCode.getInfo() : info)
                .build();
    }

}

package com.turnhub.turnservice.common;

import com.turnhub.turnservice.common.error.ErrorKind;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /*
     * 响应状态码（与 HTTP 状态一致）
     * 200: 成功
     * 400: 参数错误
     * 404: 对局/快照不存在
     * 409: 状态冲突（非法迁移、推进进行中、需要人工恢复）
     * 422: 延时被拒绝（次数/余额）
     * 500: 备份失败
     * 502: 引擎无响应
     */
    int code,

    String message,

    /*
     * 业务错误类别，成功时为 null
     */
    ErrorKind errorKind,

    T data
) implements Serializable {

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null, null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", null, data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, null, data);
    }

    /**
     * 业务失败响应
     */
    public static <T> ApiResponse<T> error(ErrorKind kind, String message) {
        return new ApiResponse<>(kind.httpStatus().value(), message, kind, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null, null);
    }
}

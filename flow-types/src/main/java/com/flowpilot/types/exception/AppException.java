package com.flowpilot.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用业务异常。
 * <p>
 * 携带 {@link com.flowpilot.types.enums.ResponseCode} 中定义的异常码，
 * 由接口层统一映射为响应体与 HTTP 状态。
 * </p>
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2981746115732045903L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{code='" + code + "', info='" + info + "'}";
    }

}

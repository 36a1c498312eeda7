package com.example.zeitpal.exception;

/**
 * 業務ルール違反。エラーコードから HTTP ステータスを決定する
 * ({@link GlobalExceptionHandler} 参照)。
 */
public class BusinessException extends RuntimeException {

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONFLICT = "CONFLICT";
    public static final String INVALID_STATE = "INVALID_STATE";
    public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
        this.parameters = new Object[0];
    }

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public static BusinessException notFound(String message, Object... parameters) {
        return new BusinessException(NOT_FOUND, message, parameters);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}

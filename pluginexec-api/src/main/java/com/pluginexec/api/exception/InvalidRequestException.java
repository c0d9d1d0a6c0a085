package com.pluginexec.api.exception;

import com.pluginexec.api.model.ErrorKind;

/**
 * 无效请求异常
 * 当请求字段不满足约束时抛出此异常。
 */
public class InvalidRequestException extends ExecutionRejectedException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(ErrorKind.INVALID_REQUEST, field, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

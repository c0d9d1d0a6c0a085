package com.pluginexec.starter.dto;

import com.pluginexec.api.model.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 拒绝或失败的错误描述
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponseDTO {

    private String kind;

    private String message;

    private boolean retryable;

    public static ErrorResponseDTO of(ErrorKind kind, String message) {
        return new ErrorResponseDTO(kind.name(), message, kind.isRetryable());
    }
}

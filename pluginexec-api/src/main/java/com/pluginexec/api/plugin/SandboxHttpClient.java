package com.pluginexec.api.plugin;

import java.util.Map;

/**
 * 沙箱 HTTP 客户端
 * <p>
 * 违规访问抛出 {@link com.pluginexec.api.exception.SandboxViolationException}。
 */
public interface SandboxHttpClient {

    Response get(String url);

    Response get(String url, Map<String, String> headers);

    Response post(String url, String body, Map<String, String> headers);

    /**
     * 出站响应
     */
    interface Response {

        int statusCode();

        String body();

        Map<String, String> headers();
    }
}

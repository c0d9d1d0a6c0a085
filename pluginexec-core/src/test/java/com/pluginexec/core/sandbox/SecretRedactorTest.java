package com.pluginexec.core.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SecretRedactor 单元测试")
public class SecretRedactorTest {

    @Test
    @DisplayName("替换所有出现的密钥值")
    void shouldMaskAllOccurrences() {
        SecretRedactor redactor = SecretRedactor.of(List.of("abc123"));

        assertEquals("key=*** again ***", redactor.redact("key=abc123 again abc123"));
    }

    @Test
    @DisplayName("长密钥优先，避免残留片段")
    void longerSecretsShouldWin() {
        SecretRedactor redactor = SecretRedactor.of(List.of("abc", "abcdef"));

        assertEquals("token ***", redactor.redact("token abcdef"));
    }

    @Test
    @DisplayName("无密钥或空文本时原样返回")
    void noSecretsShouldPassThrough() {
        assertEquals("plain", SecretRedactor.of(List.of()).redact("plain"));
        assertNull(SecretRedactor.of(List.of("x")).redact(null));
    }
}

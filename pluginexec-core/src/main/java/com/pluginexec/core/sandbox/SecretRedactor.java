package com.pluginexec.core.sandbox;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 密钥脱敏：把出现在文本中的密钥值替换为 ***
 */
public class SecretRedactor {

    static final String MASK = "***";

    private static final SecretRedactor NONE = new SecretRedactor(List.of());

    private final List<String> values;

    private SecretRedactor(List<String> values) {
        this.values = values;
    }

    public static SecretRedactor of(Collection<String> secretValues) {
        if (secretValues == null || secretValues.isEmpty()) {
            return NONE;
        }
        // 长的先替换，避免一个密钥是另一个的子串时残留片段
        List<String> sorted = secretValues.stream()
                .filter(v -> v != null && !v.isEmpty())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
        return new SecretRedactor(sorted);
    }

    public String redact(String text) {
        if (text == null || values.isEmpty()) {
            return text;
        }
        String result = text;
        for (String value : values) {
            result = result.replace(value, MASK);
        }
        return result;
    }
}

package com.pluginexec.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * 缓存指纹：pluginId + actionName + SHA-256(规范化参数 JSON) + 插件版本
 */
@Value
public class CacheKey {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    String pluginId;
    String actionName;
    String paramsHash;
    String pluginVersion;

    public static CacheKey of(String pluginId, String actionName, Map<String, Object> params, String pluginVersion) {
        return new CacheKey(pluginId, actionName, hash(params), pluginVersion);
    }

    public String fingerprint() {
        return pluginId + ":" + actionName + ":" + paramsHash + ":" + pluginVersion;
    }

    static String hash(Map<String, Object> params) {
        try {
            // 先转树再输出，保证嵌套 Map 同样按键排序
            Object canonical = CANONICAL.treeToValue(CANONICAL.valueToTree(params != null ? params : Map.of()),
                    Object.class);
            byte[] json = CANONICAL.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Params are not JSON serializable: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return fingerprint();
    }
}

package com.pluginexec.core.cache;

import com.pluginexec.api.model.ExecutionResult;

import java.util.Optional;

/**
 * 执行结果缓存
 */
public interface ResultCache {

    /**
     * 读取未过期的结果
     */
    Optional<ExecutionResult> get(CacheKey key);

    /**
     * 写入结果，ttlMs 到期后不可再读
     */
    void put(CacheKey key, ExecutionResult result, long ttlMs);

    void invalidate(CacheKey key);

    /**
     * 失效某插件的全部条目（插件更新或卸载）
     *
     * @return 失效条目数
     */
    int invalidatePlugin(String pluginId);

    long size();

    /**
     * 健康探测：缓存能否正常响应
     */
    boolean isResponsive();
}

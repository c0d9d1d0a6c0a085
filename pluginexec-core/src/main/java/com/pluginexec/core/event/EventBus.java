package com.pluginexec.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 引擎事件总线（同步分发）
 * <p>
 * 监听器异常只记录日志，不影响发布方（执行链路不能被观测组件打断）。
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends EngineEvent>, List<Consumer<? super EngineEvent>>> listeners =
            new ConcurrentHashMap<>();

    /**
     * 注册监听器
     */
    @SuppressWarnings("unchecked")
    public <E extends EngineEvent> void subscribe(Class<E> eventType, Consumer<? super E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(event -> listener.accept((E) event));
    }

    public void publish(EngineEvent event) {
        List<Consumer<? super EngineEvent>> list = listeners.get(event.getClass());
        if (list == null) {
            return;
        }
        for (Consumer<? super EngineEvent> listener : list) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public void clear() {
        listeners.clear();
    }
}

package com.pluginexec.example.config;

import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.api.plugin.SandboxHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 演示插件，由 starter 的内存注册中心收集
 */
@Configuration
public class DemoPluginConfig {

    @Bean
    public PluginDescriptor demoPlugin() {
        return PluginDescriptor.builder()
                .id("p1")
                .version("1.0.0")
                .action("ping", (ctx, params) -> "pong")
                .action("echo", (ctx, params) -> Map.of("echo", params))
                .action("sleep", (ctx, params) -> {
                    long ms = ((Number) params.getOrDefault("ms", 1000)).longValue();
                    ctx.log("sleeping " + ms + "ms");
                    Thread.sleep(ms);
                    return "slept " + ms;
                })
                .action("fail", (ctx, params) -> {
                    throw new IllegalStateException(String.valueOf(params.getOrDefault("message", "boom")));
                })
                // 出站请求受白名单约束，见 ALLOWED_DOMAINS
                .action("fetch", (ctx, params) -> {
                    String url = String.valueOf(params.get("url"));
                    Map<String, String> headers = new LinkedHashMap<>();
                    ctx.secret("apiKey").ifPresent(key -> headers.put("Authorization", "Bearer " + key));
                    SandboxHttpClient.Response response = ctx.http().get(url, headers);
                    ctx.log("fetched " + url + " -> " + response.statusCode());
                    return Map.of("statusCode", response.statusCode(), "body", response.body());
                })
                .build();
    }
}

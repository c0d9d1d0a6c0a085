package com.pluginexec.core.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.model.ExecutionStatus;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.TestPlugins;
import com.pluginexec.core.sandbox.network.HostResolver;
import com.pluginexec.core.sandbox.network.NetworkGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("SandboxedRuntime 单元测试")
public class SandboxedRuntimeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SandboxedRuntime runtime;
    private SandboxLimits limits;
    private PluginDescriptor plugin;

    @BeforeEach
    void setUp() {
        runtime = new SandboxedRuntime("w-test", ThreadIsolatedUnit.factory(),
                new NetworkGuard(List.of("api.example.com"), 10), MAPPER);
        runtime.start();
        limits = SandboxLimits.builder()
                .maxMemoryBytes(512L * 1024 * 1024)
                .maxCpuPercent(100)
                .timeoutMs(5_000)
                .networkRateLimit(10)
                .maxNetworkBytes(1024)
                .build();
        plugin = TestPlugins.demo();
    }

    @AfterEach
    void tearDown() {
        runtime.shutdown();
    }

    @Nested
    @DisplayName("正常执行")
    class SuccessTests {

        @Test
        @DisplayName("返回值规范化为 JSON")
        void outputShouldBeJsonNode() {
            ExecutionResult result = runtime.execute(plugin, "ping", Map.of(), Map.of(), limits);

            assertEquals(ExecutionStatus.SUCCESS, result.getStatus());
            assertTrue(result.getOutput() instanceof JsonNode);
            assertEquals("pong", ((JsonNode) result.getOutput()).asText());
            assertNull(result.getError());
        }

        @Test
        @DisplayName("参数原样传入插件")
        void paramsShouldReachPlugin() {
            ExecutionResult result = runtime.execute(plugin, "echo", Map.of("x", 42), Map.of(), limits);

            JsonNode output = (JsonNode) result.getOutput();
            assertEquals(42, output.path("echo").path("x").asInt());
        }

        @Test
        @DisplayName("同一单元可连续执行")
        void unitShouldBeReusable() {
            runtime.execute(plugin, "ping", Map.of(), Map.of(), limits);
            ExecutionResult second = runtime.execute(plugin, "ping", Map.of(), Map.of(), limits);

            assertTrue(second.isSuccess());
            assertEquals(1, runtime.getGeneration());
            assertTrue(runtime.isHealthy());
        }

        @Test
        @DisplayName("无法序列化的返回值视为执行错误")
        void unserializableOutputShouldFail() {
            PluginDescriptor odd = PluginDescriptor.builder()
                    .id("odd").version("1")
                    .action("object", (ctx, params) -> new Object())
                    .build();

            ExecutionResult result = runtime.execute(odd, "object", Map.of(), Map.of(), limits);

            assertEquals(ErrorKind.EXECUTION_ERROR, result.errorKind());
        }

        @Test
        @DisplayName("未知动作")
        void unknownActionShouldBeNotFound() {
            ExecutionResult result = runtime.execute(plugin, "nope", Map.of(), Map.of(), limits);

            assertEquals(ErrorKind.PLUGIN_NOT_FOUND, result.errorKind());
        }
    }

    @Nested
    @DisplayName("失败分类")
    class FailureTests {

        @Test
        @DisplayName("插件抛出异常为执行错误，单元保持可用")
        void exceptionShouldBeExecutionError() {
            ExecutionResult result = runtime.execute(plugin, "fail", Map.of(), Map.of(), limits);

            assertEquals(ExecutionStatus.ERROR, result.getStatus());
            assertEquals(ErrorKind.EXECUTION_ERROR, result.errorKind());
            assertEquals("boom", result.getError().getMessage());
            assertTrue(runtime.isHealthy());
        }

        @Test
        @DisplayName("Error 逃逸视为崩溃，单元作废，重启后代数递增")
        void errorShouldCrashUnit() {
            ExecutionResult result = runtime.execute(plugin, "crash", Map.of(), Map.of(), limits);

            assertEquals(ErrorKind.CRASHED_PROCESS, result.errorKind());
            assertFalse(runtime.isHealthy());

            runtime.restart();
            assertEquals(2, runtime.getGeneration());
            assertTrue(runtime.execute(plugin, "ping", Map.of(), Map.of(), limits).isSuccess());
        }

        @Test
        @DisplayName("超时在截止时间附近返回并终止单元")
        void timeoutShouldKillUnit() {
            long start = System.nanoTime();
            ExecutionResult result = runtime.execute(plugin, "sleep", Map.of("ms", 5_000), Map.of(),
                    limits.withTimeoutMs(200));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(ExecutionStatus.TIMEOUT, result.getStatus());
            assertEquals(ErrorKind.TIMEOUT, result.errorKind());
            assertTrue(elapsedMs < 1_500, "elapsed " + elapsedMs + "ms");
            assertFalse(runtime.isHealthy());
        }

        @Test
        @DisplayName("取消令牌终止执行")
        void cancellationShouldStopExecution() throws Exception {
            CancellationToken token = new CancellationToken();
            CompletableFuture<ExecutionResult> future = CompletableFuture.supplyAsync(() ->
                    runtime.execute(plugin, "sleep", Map.of("ms", 5_000), Map.of(), limits, token));

            Thread.sleep(150);
            assertTrue(token.cancel());
            assertFalse(token.cancel());

            ExecutionResult result = future.get(2, TimeUnit.SECONDS);
            assertEquals(ErrorKind.CANCELLED, result.errorKind());
        }

        @Test
        @DisplayName("开始前已取消则不执行")
        void cancelledBeforeStartShouldNotRun() {
            CancellationToken token = new CancellationToken();
            token.cancel();

            ExecutionResult result = runtime.execute(plugin, "ping", Map.of(), Map.of(), limits, token);

            assertEquals(ErrorKind.CANCELLED, result.errorKind());
            assertTrue(runtime.isHealthy());
        }

        @Test
        @DisplayName("忽略中断的插件在超时后被强制终止")
        void interruptIgnoringPluginShouldBeStopped() throws Exception {
            AtomicReference<Thread> unitThread = new AtomicReference<>();
            AtomicLong spins = new AtomicLong();
            PluginDescriptor spinner = PluginDescriptor.builder()
                    .id("p-spin")
                    .version("1.0.0")
                    .action("spin", (ctx, params) -> {
                        unitThread.set(Thread.currentThread());
                        while (spins.get() >= 0) {
                            spins.incrementAndGet();
                        }
                        return spins.get();
                    })
                    .build();

            ExecutionResult result = runtime.execute(spinner, "spin", Map.of(), Map.of(),
                    limits.withTimeoutMs(200));

            assertEquals(ErrorKind.TIMEOUT, result.errorKind());
            Thread thread = unitThread.get();
            assertNotNull(thread);
            thread.join(2_000);
            assertFalse(thread.isAlive());

            long settled = spins.get();
            Thread.sleep(100);
            assertEquals(settled, spins.get());
            assertFalse(runtime.isHealthy());
        }

        @Test
        @DisplayName("持有的存活内存超限被终止")
        void memoryLimitShouldKill() {
            assumeTrue(ThreadResourceMonitor.getInstance().isAllocationSupported());
            // 基线前先回收，避免开始时堆里的垃圾抵消增长
            System.gc();

            ExecutionResult result = runtime.execute(plugin, "allocate", Map.of(), Map.of(),
                    limits.toBuilder().maxMemoryBytes(16L * 1024 * 1024).build());

            assertEquals(ErrorKind.RESOURCE_EXCEEDED, result.errorKind());
            assertTrue(result.getPeakMemoryBytes() > 16L * 1024 * 1024);
            assertFalse(runtime.isHealthy());
        }

        @Test
        @DisplayName("短命垃圾不计入内存上限")
        void garbageShouldNotCountAgainstMemoryLimit() {
            assumeTrue(ThreadResourceMonitor.getInstance().isAllocationSupported());

            ExecutionResult result = runtime.execute(plugin, "churn", Map.of("rounds", 400), Map.of(),
                    limits.toBuilder().maxMemoryBytes(64L * 1024 * 1024).build());

            assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
            assertTrue(result.getPeakMemoryBytes() <= 64L * 1024 * 1024);
            assertTrue(runtime.isHealthy());
        }
    }

    @Nested
    @DisplayName("网络与密钥")
    class NetworkAndSecretTests {

        @Test
        @DisplayName("插件吞掉拒绝异常也无法改变结果")
        void swallowedDenialShouldStillFail() {
            PluginDescriptor sneaky = PluginDescriptor.builder()
                    .id("sneaky").version("1")
                    .action("sneak", (ctx, params) -> {
                        try {
                            ctx.http().get("http://127.0.0.1:8080/admin");
                        } catch (SandboxViolationException e) {
                            ctx.log("ignored: " + e.getMessage());
                        }
                        return "looks fine";
                    })
                    .build();

            ExecutionResult result = runtime.execute(sneaky, "sneak", Map.of(), Map.of(), limits);

            assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, result.errorKind());
            assertNull(result.getOutput());
        }

        @Test
        @DisplayName("白名单域名解析到私网地址被拒绝")
        void allowedHostResolvingPrivateShouldBeDenied() {
            HostResolver internal = host -> new InetAddress[]{InetAddress.getByName("10.0.0.5")};
            SandboxedRuntime guarded = new SandboxedRuntime("w-dns", ThreadIsolatedUnit.factory(),
                    new NetworkGuard(List.of("api.example.com"), 10, internal), MAPPER);
            guarded.start();
            PluginDescriptor fetcher = PluginDescriptor.builder()
                    .id("fetcher").version("1")
                    .action("fetch", (ctx, params) -> ctx.http().get("https://api.example.com/data").body())
                    .build();
            try {
                ExecutionResult result = guarded.execute(fetcher, "fetch", Map.of(), Map.of(), limits);

                assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, result.errorKind());
            } finally {
                guarded.shutdown();
            }
        }

        @Test
        @DisplayName("密钥在日志与错误信息中被脱敏")
        void secretsShouldBeRedacted() {
            ExecutionResult result = runtime.execute(plugin, "secret", Map.of(),
                    Map.of("apiKey", "s3cr3t-value"), limits);

            assertEquals(ErrorKind.EXECUTION_ERROR, result.errorKind());
            assertEquals("upstream rejected key ***", result.getError().getMessage());
            assertEquals(List.of("calling upstream with key ***"), result.getLogs());
            assertFalse(result.toString().contains("s3cr3t-value"));
        }
    }
}

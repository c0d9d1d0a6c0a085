package com.pluginexec.core.sandbox.network;

import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.model.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.sun.net.httpserver.HttpServer;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NetworkGuard 单元测试")
public class NetworkGuardTest {

    private static final HostResolver PUBLIC = host -> new InetAddress[]{InetAddress.getByName("93.184.216.34")};

    private static NetworkGuard guard(HostResolver resolver, String... domains) {
        return new NetworkGuard(List.of(domains), 10, resolver);
    }

    @Nested
    @DisplayName("地址黑名单")
    class ForbiddenAddressTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "127.0.0.1", "10.1.2.3", "172.16.0.1", "192.168.1.1", "169.254.169.254",
                "0.0.0.0", "0.1.2.3", "100.64.0.1", "100.127.255.254", "224.0.0.1",
                "::1", "fe80::1", "fc00::1", "fd12:3456::1", "::"
        })
        @DisplayName("非公网地址被拒绝")
        void nonPublicAddressesShouldBeForbidden(String ip) throws Exception {
            assertTrue(NetworkGuard.isForbiddenAddress(InetAddress.getByName(ip)), ip);
        }

        @ParameterizedTest
        @ValueSource(strings = {"93.184.216.34", "8.8.8.8", "100.128.0.1", "2606:4700::1111"})
        @DisplayName("公网地址放行")
        void publicAddressesShouldBeAllowed(String ip) throws Exception {
            assertFalse(NetworkGuard.isForbiddenAddress(InetAddress.getByName(ip)), ip);
        }
    }

    @Nested
    @DisplayName("域名白名单")
    class AllowListTests {

        @Test
        @DisplayName("精确匹配")
        void exactMatch() {
            NetworkGuard guard = guard(PUBLIC, "api.example.com");

            assertTrue(guard.isHostAllowed("api.example.com"));
            assertTrue(guard.isHostAllowed("API.Example.com"));
            assertFalse(guard.isHostAllowed("evil.api.example.com"));
            assertFalse(guard.isHostAllowed("example.com"));
        }

        @Test
        @DisplayName("通配符匹配子域名但不匹配顶级域本身")
        void wildcardShouldMatchSubdomainsOnly() {
            NetworkGuard guard = guard(PUBLIC, "*.example.com");

            assertTrue(guard.isHostAllowed("a.example.com"));
            assertTrue(guard.isHostAllowed("a.b.example.com"));
            assertFalse(guard.isHostAllowed("example.com"));
            assertFalse(guard.isHostAllowed("badexample.com"));
        }

        @Test
        @DisplayName("空白名单拒绝一切")
        void emptyAllowListShouldDenyAll() {
            NetworkGuard guard = new NetworkGuard(null, 10, PUBLIC);

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("https://api.example.com/x")));
            assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, e.getKind());
        }
    }

    @Nested
    @DisplayName("checkAccess")
    class CheckAccessTests {

        @Test
        @DisplayName("白名单域名解析到公网地址时放行")
        void allowedPublicHostShouldPass() {
            NetworkGuard guard = guard(PUBLIC, "api.example.com");

            assertDoesNotThrow(() -> guard.checkAccess("p1", URI.create("https://api.example.com/v1")));
        }

        @Test
        @DisplayName("白名单域名解析到私网地址时拒绝")
        void allowedHostResolvingToPrivateShouldBeDenied() {
            HostResolver rebinding = host -> new InetAddress[]{
                    InetAddress.getByName("93.184.216.34"), InetAddress.getByName("10.0.0.5")};
            NetworkGuard guard = guard(rebinding, "api.example.com");

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("https://api.example.com/v1")));
            assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, e.getKind());
        }

        @Test
        @DisplayName("元数据主机名始终拒绝")
        void metadataHostShouldBeDenied() {
            NetworkGuard guard = guard(PUBLIC, "metadata.google.internal");

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("http://metadata.google.internal/computeMetadata")));
            assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, e.getKind());
        }

        @Test
        @DisplayName("只允许 http 与 https")
        void onlyHttpSchemesShouldBeAllowed() {
            NetworkGuard guard = guard(PUBLIC, "api.example.com");

            assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("file:///etc/passwd")));
            assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("ftp://api.example.com/x")));
        }

        @Test
        @DisplayName("解析失败视为网络错误")
        void unresolvableHostShouldBeNetworkError() {
            HostResolver failing = host -> {
                throw new UnknownHostException(host);
            };
            NetworkGuard guard = guard(failing, "api.example.com");

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> guard.checkAccess("p1", URI.create("https://api.example.com/")));
            assertEquals(ErrorKind.NETWORK_ERROR, e.getKind());
        }
    }

    @Nested
    @DisplayName("建连地址")
    class ConnectAddressTests {

        private HttpServer server;
        private final AtomicInteger hits = new AtomicInteger();

        @BeforeEach
        void startServer() throws Exception {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            server.createContext("/", exchange -> {
                hits.incrementAndGet();
                byte[] body = "internal".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, body.length);
                exchange.getResponseBody().write(body);
                exchange.close();
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private String localUrl() {
            return "http://localhost:" + server.getAddress().getPort() + "/admin";
        }

        @Test
        @DisplayName("校验通过后再次解析到回环地址也无法连到本机")
        void rebindingAfterCheckShouldNotReachLoopback() {
            AtomicInteger lookups = new AtomicInteger();
            HostResolver rebinding = host -> lookups.getAndIncrement() == 0
                    ? new InetAddress[]{InetAddress.getByName("192.0.2.10")}
                    : new InetAddress[]{InetAddress.getLoopbackAddress()};
            GuardedHttpClient client = new GuardedHttpClient("p1", guard(rebinding, "localhost"), 1024, () -> 500);

            assertThrows(SandboxViolationException.class, () -> client.get(localUrl()));

            assertTrue(lookups.get() >= 1);
            assertEquals(0, hits.get());
        }

        @Test
        @DisplayName("守卫解析与系统解析不一致时以守卫结果建连")
        void connectionShouldUseGuardResolution() {
            HostResolver publicOnly = host -> new InetAddress[]{InetAddress.getByName("192.0.2.10")};
            GuardedHttpClient client = new GuardedHttpClient("p1", guard(publicOnly, "localhost"), 1024, () -> 500);

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> client.get(localUrl()));

            assertEquals(ErrorKind.NETWORK_ERROR, e.getKind());
            assertEquals(0, hits.get());
            assertNull(client.getViolation());
        }

        @Test
        @DisplayName("建连时解析到回环地址记为粘性拒绝")
        void loopbackResolutionShouldBeDenied() {
            HostResolver loopback = host -> new InetAddress[]{InetAddress.getLoopbackAddress()};
            GuardedHttpClient client = new GuardedHttpClient("p1", guard(loopback, "localhost"), 1024, () -> 500);

            SandboxViolationException e = assertThrows(SandboxViolationException.class,
                    () -> client.get(localUrl()));

            assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, e.getKind());
            assertNotNull(client.getViolation());
            assertEquals(0, hits.get());
        }
    }

    @Test
    @DisplayName("白名单中的 IP 字面量不经解析器直接校验")
    void forbiddenLiteralShouldBeDeniedWithoutResolution() {
        NetworkGuard guard = guard(PUBLIC, "127.0.0.1");

        SandboxViolationException e = assertThrows(SandboxViolationException.class,
                () -> guard.checkTarget("p1", URI.create("http://127.0.0.1:8080/admin")));
        assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, e.getKind());
    }

    @Test
    @DisplayName("按插件限流，超限抛出网络错误")
    void rateLimitShouldBePerPlugin() {
        NetworkGuard guard = new NetworkGuard(List.of("api.example.com"), 2, PUBLIC);

        guard.acquirePermit("p1");
        guard.acquirePermit("p1");
        SandboxViolationException e = assertThrows(SandboxViolationException.class,
                () -> guard.acquirePermit("p1"));
        assertEquals(ErrorKind.NETWORK_ERROR, e.getKind());

        assertDoesNotThrow(() -> guard.acquirePermit("p2"));
    }

    @Test
    @DisplayName("GuardedHttpClient 记录粘性违规")
    void guardedClientShouldRecordStickyViolation() {
        GuardedHttpClient client = new GuardedHttpClient("p1",
                guard(PUBLIC, "api.example.com"), 1024, () -> 1_000);

        assertThrows(SandboxViolationException.class, () -> client.get("http://127.0.0.1:8080/admin"));

        assertNotNull(client.getViolation());
        assertEquals(ErrorKind.NETWORK_ACCESS_DENIED, client.getViolation().getKind());
        assertEquals(0, client.getBytesRead());
    }
}

package com.pluginexec.core.sandbox.network;

import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.core.resilience.RateLimiter;
import com.pluginexec.core.resilience.TokenBucketRateLimiter;
import com.pluginexec.core.sandbox.SandboxLimits;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.net.InetAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 出站网络守卫（所有工作单元共享）
 * <p>
 * 1. 域名白名单：精确匹配或 *.suffix
 * 2. 地址黑名单：解析后的每个地址都必须是公网地址，云厂商元数据端点始终拒绝
 * 3. 按插件限流（令牌桶）
 * <p>
 * 重定向一律不跟随，避免白名单域名跳转到内网地址。
 * 连接只使用 {@link #resolveChecked} 校验过的地址，校验与建连之间不存在第二次解析。
 */
@Slf4j
public class NetworkGuard {

    private static final Set<String> METADATA_HOSTS = Set.of(
            "metadata.google.internal",
            "metadata");

    private static final Set<InetAddress> METADATA_ADDRESSES = Set.of(
            literal("169.254.169.254"),
            literal("fd00:ec2::254"));

    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final List<String> allowedDomains;
    private final double rateLimitPerSecond;
    private final HostResolver resolver;
    private final OkHttpClient httpClient;

    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();

    public NetworkGuard(List<String> allowedDomains, double rateLimitPerSecond) {
        this(allowedDomains, rateLimitPerSecond, HostResolver.SYSTEM);
    }

    public NetworkGuard(List<String> allowedDomains, double rateLimitPerSecond, HostResolver resolver) {
        this.allowedDomains = allowedDomains == null ? List.of() : allowedDomains.stream()
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .filter(d -> !d.isEmpty())
                .collect(Collectors.toList());
        this.rateLimitPerSecond = rateLimitPerSecond;
        this.resolver = resolver;
        this.httpClient = new OkHttpClient.Builder()
                .followRedirects(false)
                .followSslRedirects(false)
                .proxy(Proxy.NO_PROXY)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public static NetworkGuard from(SandboxLimits limits) {
        return new NetworkGuard(limits.getAllowedDomains(), limits.getNetworkRateLimit());
    }

    /**
     * 校验目标地址（含解析），违规时抛出 {@link SandboxViolationException}
     */
    public List<InetAddress> checkAccess(String pluginId, URI uri) {
        return resolveChecked(pluginId, checkTarget(pluginId, uri));
    }

    /**
     * 不涉及解析的校验：协议、元数据主机、白名单，以及 IP 字面量本身
     *
     * @return 规范化后的主机名
     */
    public String checkTarget(String pluginId, URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw denied(pluginId, "Unsupported scheme: " + scheme);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw denied(pluginId, "Missing host in " + uri);
        }
        host = stripBrackets(host.toLowerCase(Locale.ROOT));

        if (METADATA_HOSTS.contains(host)) {
            throw denied(pluginId, "Metadata endpoint is not reachable: " + host);
        }
        if (!isHostAllowed(host)) {
            throw denied(pluginId, "Host is not in the allow-list: " + host);
        }
        // 字面量不经过解析器，单独校验
        if (isIpLiteral(host)) {
            InetAddress address;
            try {
                address = InetAddress.getByName(host);
            } catch (UnknownHostException e) {
                throw new SandboxViolationException(ErrorKind.NETWORK_ACCESS_DENIED, "Invalid address: " + host, e);
            }
            if (isForbiddenAddress(address)) {
                throw denied(pluginId, "Address is not public: " + host);
            }
        }
        return host;
    }

    /**
     * 解析主机并要求每个地址都是公网地址，返回的地址即建连地址
     */
    public List<InetAddress> resolveChecked(String pluginId, String host) {
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new SandboxViolationException(ErrorKind.NETWORK_ERROR, "Unable to resolve host: " + host, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new SandboxViolationException(ErrorKind.NETWORK_ERROR, "Unable to resolve host: " + host);
        }
        for (InetAddress address : addresses) {
            if (isForbiddenAddress(address)) {
                throw denied(pluginId, "Host " + host + " resolves to a non-public address " + address.getHostAddress());
            }
        }
        return List.copyOf(Arrays.asList(addresses));
    }

    /**
     * 按插件限流
     */
    public void acquirePermit(String pluginId) {
        RateLimiter limiter = rateLimiters.computeIfAbsent(pluginId,
                k -> new TokenBucketRateLimiter(k, rateLimitPerSecond, Math.max(1.0, rateLimitPerSecond)));
        if (!limiter.tryAcquire()) {
            log.debug("[{}] Outbound rate limit exceeded", pluginId);
            throw new SandboxViolationException(ErrorKind.NETWORK_ERROR,
                    "Outbound request rate limit exceeded (" + rateLimitPerSecond + "/s)");
        }
    }

    public boolean isHostAllowed(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        for (String pattern : allowedDomains) {
            if (pattern.startsWith("*.")) {
                if (h.endsWith(pattern.substring(1))) {
                    return true;
                }
            } else if (pattern.equals(h)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 回环、私网、链路本地、通配、组播、CGNAT、IPv6 ULA 以及元数据地址
     */
    public static boolean isForbiddenAddress(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress()
                || address.isMulticastAddress()
                || METADATA_ADDRESSES.contains(address)) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (bytes.length == 4) {
            int first = bytes[0] & 0xff;
            int second = bytes[1] & 0xff;
            // 0.0.0.0/8, 100.64.0.0/10
            return first == 0 || (first == 100 && (second & 0xc0) == 64);
        }
        // fc00::/7
        return (bytes[0] & 0xfe) == 0xfc;
    }

    OkHttpClient httpClient() {
        return httpClient;
    }

    public void forgetPlugin(String pluginId) {
        rateLimiters.remove(pluginId);
    }

    private SandboxViolationException denied(String pluginId, String message) {
        log.warn("[{}] Network access denied: {}", pluginId, message);
        return new SandboxViolationException(ErrorKind.NETWORK_ACCESS_DENIED, message);
    }

    static boolean isIpLiteral(String host) {
        return host.indexOf(':') >= 0 || IPV4_LITERAL.matcher(host).matches();
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static InetAddress literal(String ip) {
        try {
            return InetAddress.getByName(ip);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid literal address " + ip, e);
        }
    }
}

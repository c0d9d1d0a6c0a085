package com.pluginexec.core.sandbox.network;

import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.plugin.SandboxHttpClient;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 单次执行内的受控 HTTP 客户端
 * <p>
 * 每次请求先过 {@link NetworkGuard}，建连地址来自守卫的校验解析，响应体按执行级字节预算读取。
 * 访问拒绝与预算超限会被记录为粘性违规：插件吞掉异常也无法改变执行结果。
 */
@Slf4j
public class GuardedHttpClient implements SandboxHttpClient {

    private final String pluginId;
    private final NetworkGuard guard;
    private final AtomicLong remainingBytes;
    private final long maxBytes;
    private final LongSupplier remainingMillis;
    private final AtomicReference<SandboxViolationException> violation = new AtomicReference<>();

    private OkHttpClient client;

    public GuardedHttpClient(String pluginId, NetworkGuard guard, long maxBytes, LongSupplier remainingMillis) {
        this.pluginId = pluginId;
        this.guard = guard;
        this.maxBytes = maxBytes;
        this.remainingBytes = new AtomicLong(maxBytes);
        this.remainingMillis = remainingMillis;
    }

    @Override
    public Response get(String url) {
        return get(url, Map.of());
    }

    @Override
    public Response get(String url, Map<String, String> headers) {
        return send("GET", url, null, headers);
    }

    @Override
    public Response post(String url, String body, Map<String, String> headers) {
        return send("POST", url, body, headers);
    }

    /**
     * 首个粘性违规，没有则为 null
     */
    public SandboxViolationException getViolation() {
        return violation.get();
    }

    public long getBytesRead() {
        return maxBytes - Math.max(0, remainingBytes.get());
    }

    private Response send(String method, String url, String body, Map<String, String> headers) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw sticky(new SandboxViolationException(ErrorKind.NETWORK_ACCESS_DENIED, "Malformed URL: " + url, e));
        }

        try {
            guard.checkTarget(pluginId, uri);
        } catch (SandboxViolationException e) {
            if (e.getKind() == ErrorKind.NETWORK_ACCESS_DENIED) {
                throw sticky(e);
            }
            throw e;
        }
        HttpUrl httpUrl = HttpUrl.parse(uri.toString());
        if (httpUrl == null) {
            throw sticky(new SandboxViolationException(ErrorKind.NETWORK_ACCESS_DENIED, "Malformed URL: " + url));
        }
        guard.acquirePermit(pluginId);

        Request.Builder builder = new Request.Builder().url(httpUrl);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        if ("POST".equals(method)) {
            String contentType = headers != null ? headers.get("Content-Type") : null;
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            builder.post(RequestBody.create(body != null ? body : "", mediaType));
        } else {
            builder.get();
        }

        Call call = client().newCall(builder.build());
        call.timeout().timeout(Math.max(1, remainingMillis.getAsLong()), TimeUnit.MILLISECONDS);
        try (okhttp3.Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? readBounded(responseBody.byteStream()) : "";
            Map<String, String> responseHeaders = new LinkedHashMap<>();
            for (String name : response.headers().names()) {
                responseHeaders.put(name, response.header(name));
            }
            return new SimpleResponse(response.code(), text, responseHeaders);
        } catch (IOException e) {
            SandboxViolationException denial = findViolation(e);
            if (denial != null) {
                throw denial;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new SandboxViolationException(ErrorKind.CANCELLED, "Outbound request interrupted", e);
            }
            throw new SandboxViolationException(ErrorKind.NETWORK_ERROR,
                    method + " " + uri.getHost() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * 本次执行专用的客户端，共享守卫的连接池，解析交给 {@link #lookup}
     */
    private synchronized OkHttpClient client() {
        if (client == null) {
            client = guard.httpClient().newBuilder().dns(this::lookup).build();
        }
        return client;
    }

    /**
     * OkHttp 只认 {@link UnknownHostException}，守卫的拒绝挂在其 cause 上带出
     */
    private List<InetAddress> lookup(String host) throws UnknownHostException {
        try {
            return guard.resolveChecked(pluginId, host);
        } catch (SandboxViolationException e) {
            if (e.getKind() == ErrorKind.NETWORK_ACCESS_DENIED) {
                sticky(e);
            }
            UnknownHostException wrapped = new UnknownHostException(host);
            wrapped.initCause(e);
            throw wrapped;
        }
    }

    private static SandboxViolationException findViolation(Throwable t) {
        Throwable cursor = t;
        int depth = 0;
        while (cursor != null && depth++ < 10) {
            if (cursor instanceof SandboxViolationException) {
                return (SandboxViolationException) cursor;
            }
            cursor = cursor.getCause();
        }
        return null;
    }

    private String readBounded(InputStream in) {
        try (InputStream stream = in) {
            long budget = remainingBytes.get();
            int limit = (int) Math.min(Integer.MAX_VALUE - 1, Math.max(0, budget));
            byte[] data = stream.readNBytes(limit + 1);
            if (remainingBytes.addAndGet(-data.length) < 0) {
                throw sticky(new SandboxViolationException(ErrorKind.RESOURCE_EXCEEDED,
                        "Network byte budget exceeded (" + maxBytes + " bytes)"));
            }
            return new String(data, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxViolationException(ErrorKind.NETWORK_ERROR, "Failed to read response: " + e.getMessage(), e);
        }
    }

    private SandboxViolationException sticky(SandboxViolationException e) {
        violation.compareAndSet(null, e);
        return e;
    }

    private static final class SimpleResponse implements Response {
        private final int statusCode;
        private final String body;
        private final Map<String, String> headers;

        SimpleResponse(int statusCode, String body, Map<String, String> headers) {
            this.statusCode = statusCode;
            this.body = body;
            this.headers = headers;
        }

        @Override
        public int statusCode() {
            return statusCode;
        }

        @Override
        public String body() {
            return body;
        }

        @Override
        public Map<String, String> headers() {
            return headers;
        }
    }
}

package io.dispatch4j.internal.http;

import io.dispatch4j.CallbackSender;
import io.dispatch4j.core.CallbackException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link CallbackSender} backed by OkHttp.
 *
 * <p>Every request is a POST to the same endpoint carrying the shared secret in
 * {@link CallbackSender#SECRET_HEADER}. Only HTTP 200 counts as delivered.
 */
public class OkHttpCallbackSender implements CallbackSender {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final byte[] EMPTY = new byte[0];

    private final HttpUrl endpoint;
    private final String secret;
    private final OkHttpClient client;

    public OkHttpCallbackSender(String endpoint, String secret, Duration timeout) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.secret = Objects.requireNonNull(secret, "secret must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }

        HttpUrl url = HttpUrl.parse(endpoint);
        if (url == null) {
            throw new IllegalArgumentException("endpoint is not an http(s) URL: " + endpoint);
        }
        this.endpoint = url;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Override
    public void send(byte[] body) throws CallbackException {
        Request request = new Request.Builder()
                .url(endpoint)
                .header(SECRET_HEADER, secret)
                .post(RequestBody.create(body == null ? EMPTY : body, JSON))
                .build();

        try (Response resp = client.newCall(request).execute()) {
            if (resp.code() != 200) {
                throw new CallbackException(resp.code(),
                        "callback failed with non-ok status code " + resp.code() + ": " + resp.message());
            }
        } catch (IOException e) {
            throw new CallbackException("callback to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Release pooled connections and dispatcher threads.
     */
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}

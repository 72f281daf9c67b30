package io.dispatch4j.internal.http;

import io.dispatch4j.CallbackSender;
import io.dispatch4j.core.CallbackException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpCallbackSenderTest {

    private MockWebServer server;
    private OkHttpCallbackSender sender;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sender = new OkHttpCallbackSender(server.url("/hook").toString(), "s3cret", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        sender.close();
        server.shutdown();
    }

    @Test
    void postsBodyWithSecretHeader() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        sender.send("{\"foo\":\"bar\"}".getBytes(StandardCharsets.UTF_8));

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getPath()).isEqualTo("/hook");
        assertThat(req.getHeader(CallbackSender.SECRET_HEADER)).isEqualTo("s3cret");
        assertThat(req.getHeader("Content-Type")).startsWith("application/json");
        assertThat(req.getBody().readUtf8()).isEqualTo("{\"foo\":\"bar\"}");
    }

    @Test
    void nullBodyIsSentEmpty() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        sender.send(null);

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getBodySize()).isZero();
    }

    @Test
    void nonOkStatusIsAFailure() {
        server.enqueue(new MockResponse().setResponseCode(201));

        assertThatThrownBy(() -> sender.send(new byte[]{'{', '}'}))
                .isInstanceOf(CallbackException.class)
                .hasMessageContaining("201")
                .satisfies(e -> assertThat(((CallbackException) e).statusCode()).isEqualTo(201));
    }

    @Test
    void serverErrorIsAFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> sender.send(null))
                .isInstanceOf(CallbackException.class)
                .satisfies(e -> assertThat(((CallbackException) e).statusCode()).isEqualTo(500));
    }

    @Test
    void transportFailureHasNoStatusCode() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String url = gone.url("/hook").toString();
        gone.shutdown();
        OkHttpCallbackSender unreachable = new OkHttpCallbackSender(url, "s3cret", Duration.ofMillis(500));
        try {
            assertThatThrownBy(() -> unreachable.send(null))
                    .isInstanceOf(CallbackException.class)
                    .satisfies(e -> assertThat(((CallbackException) e).statusCode()).isEqualTo(-1));
        } finally {
            unreachable.close();
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new OkHttpCallbackSender("not a url", "s", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OkHttpCallbackSender("http://localhost/", "s", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

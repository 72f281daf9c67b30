package io.dispatch4j.testing;

import io.dispatch4j.CallbackSender;
import io.dispatch4j.core.CallbackException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingCallbackSender implements CallbackSender {
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private volatile int statusCode = 200;

    @Override
    public void send(byte[] body) throws CallbackException {
        bodies.add(body == null ? "" : new String(body, StandardCharsets.UTF_8));
        if (statusCode != 200) {
            throw new CallbackException(statusCode, "callback failed with non-ok status code " + statusCode);
        }
    }

    public List<String> bodies() {
        return List.copyOf(bodies);
    }

    public long count(String body) {
        return bodies.stream().filter(body::equals).count();
    }

    public void respondWith(int statusCode) {
        this.statusCode = statusCode;
    }
}

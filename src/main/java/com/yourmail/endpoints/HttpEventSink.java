package com.yourmail.endpoints;

import com.yourmail.hub.EventSink;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Event sink writing Server-Sent Event frames to an open HTTP exchange.
 */
class HttpEventSink implements EventSink {

    private final HttpExchange exchange;
    private final OutputStream os;

    HttpEventSink(HttpExchange exchange) {
        this.exchange = exchange;
        this.os = exchange.getResponseBody();
    }

    @Override
    public void write(String frame) throws IOException {
        os.write(frame.getBytes(StandardCharsets.UTF_8));
        os.flush();
    }

    @Override
    public void close() {
        exchange.close();
    }
}

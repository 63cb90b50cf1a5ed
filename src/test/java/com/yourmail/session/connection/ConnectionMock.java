package com.yourmail.session.connection;

import com.yourmail.session.SessionContext;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Connection over in-memory streams.
 * <p>Input lines are joined with CRLF; output is captured for assertions.
 */
public class ConnectionMock extends Connection {

    private final ByteArrayOutputStream output;

    public ConnectionMock(SessionContext context, String... lines) {
        this(context, new ByteArrayOutputStream(), lines);
    }

    private ConnectionMock(SessionContext context, ByteArrayOutputStream output, String... lines) {
        super(new ByteArrayInputStream((String.join("\r\n", lines) + "\r\n").getBytes(StandardCharsets.UTF_8)),
                output, context);
        this.output = output;
    }

    public String getOutput() {
        return output.toString(StandardCharsets.UTF_8);
    }

    public List<String> getLines() {
        return Arrays.asList(getOutput().split("\r\n"));
    }
}

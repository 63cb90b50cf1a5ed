package com.yourmail.hub;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * In-memory sink recording frames, optionally failing writes.
 */
class RecordingSink implements EventSink {
    private final List<String> frames = new ArrayList<>();
    private volatile boolean failing = false;
    private volatile boolean closed = false;

    @Override
    public synchronized void write(String frame) throws IOException {
        if (failing) {
            throw new IOException("Broken pipe");
        }
        frames.add(frame);
        notifyAll();
    }

    @Override
    public void close() {
        closed = true;
    }

    RecordingSink setFailing(boolean failing) {
        this.failing = failing;
        return this;
    }

    boolean isClosed() {
        return closed;
    }

    synchronized List<String> getFrames() {
        return new ArrayList<>(frames);
    }

    /**
     * Waits until at least the given number of frames arrived.
     */
    synchronized List<String> await(int count, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (frames.size() < count) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                break;
            }
            TimeUnit.NANOSECONDS.timedWait(this, left);
        }
        return new ArrayList<>(frames);
    }
}

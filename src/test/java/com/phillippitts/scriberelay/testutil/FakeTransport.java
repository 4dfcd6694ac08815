package com.phillippitts.scriberelay.testutil;

import com.phillippitts.scriberelay.client.protocol.ClientTransport;
import com.phillippitts.scriberelay.client.protocol.TransportConnection;
import com.phillippitts.scriberelay.client.protocol.TransportListener;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transport whose connections never touch the network. Tests drive the listener directly.
 */
public final class FakeTransport implements ClientTransport {

    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    /** One connect call. */
    public record Attempt(URI uri, Map<String, String> headers, TransportListener listener,
                          FakeConnection connection) {

        public void open() {
            listener.onOpen(connection);
        }

        public void text(String text) {
            listener.onText(text);
        }

        public void binary(byte[] data) {
            listener.onBinary(data);
        }

        public void closeFromServer(int code, String reason) {
            connection.markClosed(code, reason);
            listener.onClose(code, reason);
        }
    }

    @Override
    public TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener) {
        FakeConnection connection = new FakeConnection();
        attempts.add(new Attempt(uri, headers, listener, connection));
        return connection;
    }

    public List<Attempt> attempts() {
        return attempts;
    }

    public Attempt last() {
        if (attempts.isEmpty()) {
            throw new IllegalStateException("No connect attempt yet");
        }
        return attempts.get(attempts.size() - 1);
    }

    /** Records everything sent over it. */
    public static final class FakeConnection implements TransportConnection {

        private final List<String> texts = new CopyOnWriteArrayList<>();
        private final List<byte[]> binaries = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;
        private volatile int closeCode = -1;
        private volatile String closeReason;

        @Override
        public void sendText(String text) {
            texts.add(text);
        }

        @Override
        public void sendBinary(byte[] data) {
            binaries.add(data);
        }

        @Override
        public void close(int code, String reason) {
            markClosed(code, reason);
        }

        void markClosed(int code, String reason) {
            if (open) {
                open = false;
                closeCode = code;
                closeReason = reason;
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        public List<String> texts() {
            return texts;
        }

        public List<byte[]> binaries() {
            return binaries;
        }

        public int closeCode() {
            return closeCode;
        }

        public String closeReason() {
            return closeReason;
        }
    }
}

package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.relay.upstream.UpstreamConnection;
import com.phillippitts.scriberelay.relay.upstream.UpstreamConnector;
import com.phillippitts.scriberelay.relay.upstream.UpstreamListener;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Upstream engine stand-in; tests drive the listener by hand. */
final class FakeUpstreamConnector implements UpstreamConnector {

    final List<FakeUpstream> connections = new CopyOnWriteArrayList<>();
    volatile RuntimeException connectFailure;

    @Override
    public UpstreamConnection connect(UpstreamListener listener) {
        if (connectFailure != null) {
            throw connectFailure;
        }
        FakeUpstream upstream = new FakeUpstream(listener);
        connections.add(upstream);
        return upstream;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    FakeUpstream last() {
        if (connections.isEmpty()) {
            throw new AssertionError("No upstream connection");
        }
        return connections.get(connections.size() - 1);
    }

    static final class FakeUpstream implements UpstreamConnection {

        final UpstreamListener listener;
        final List<String> controls = new CopyOnWriteArrayList<>();
        private final ByteArrayOutputStream audio = new ByteArrayOutputStream();
        private volatile boolean closed;

        FakeUpstream(UpstreamListener listener) {
            this.listener = listener;
        }

        @Override
        public synchronized void sendAudio(byte[] pcm) {
            audio.write(pcm, 0, pcm.length);
        }

        @Override
        public void sendControl(String json) {
            controls.add(json);
        }

        @Override
        public boolean isOpen() {
            return !closed;
        }

        @Override
        public void close() {
            closed = true;
        }

        boolean closed() {
            return closed;
        }

        synchronized byte[] audio() {
            return audio.toByteArray();
        }

        void open() {
            listener.onOpen();
        }

        void message(String json) {
            listener.onMessage(json);
        }

        void closeFromEngine(int code) {
            closed = true;
            listener.onClose(code, "");
        }
    }
}

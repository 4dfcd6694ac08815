package com.phillippitts.scriberelay.service.audio.capture;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.service.audio.AudioFormat;
import com.phillippitts.scriberelay.service.audio.PcmQuantizer;
import com.phillippitts.scriberelay.service.audio.Resampler;
import com.phillippitts.scriberelay.util.RelayTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Java Sound capture at the device's native rate, resampled and quantized to PCM16LE 16 kHz
 * on the capture thread.
 *
 * <p>Java Sound exposes no portable echo cancellation, noise suppression or gain control, so
 * the raw input signal is captured.
 */
public final class JavaSoundAudioCapture implements AudioCapture {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCapture.class);

    static final String BUFFER_OVERFLOW = "BUFFER_OVERFLOW";

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final String owner;
    private final AudioCaptureProperties props;
    private final MicrophoneManager microphones;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final Resampler resampler = new Resampler();
    private final FrameAccumulator accumulator;

    private final Object lock = new Object();
    private final AtomicBoolean active = new AtomicBoolean(false);
    private Thread thread;
    private MicrophoneToken token;

    JavaSoundAudioCapture(String owner,
                          AudioCaptureProperties props,
                          MicrophoneManager microphones,
                          ApplicationEventPublisher publisher,
                          DataLineProvider provider) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.microphones = Objects.requireNonNull(microphones, "microphones must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.accumulator = new FrameAccumulator(AudioFormat.bytesForMillis(props.getMaxBufferMillis()));
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void start(Consumer<String> onFailure) {
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        synchronized (lock) {
            if (active.get()) {
                throw new IllegalStateException("Capture '" + owner + "' is already running");
            }
        }
        // Acquire outside our lock: revoking a previous holder may block briefly.
        MicrophoneToken acquired = microphones.acquire(owner, this::stop);
        synchronized (lock) {
            if (active.get()) {
                microphones.release(acquired);
                throw new IllegalStateException("Capture '" + owner + "' is already running");
            }
            token = acquired;
            accumulator.clear();
            active.set(true);
            Thread t = new Thread(() -> doCapture(onFailure), "audio-capture-" + owner);
            t.setDaemon(true);
            thread = t;
            t.start();
        }
        LOG.info("Audio capture started: owner={}, native-rate={}Hz, device='{}'",
                owner, props.getNativeSampleRate(),
                props.getDeviceName() != null ? props.getDeviceName() : "default");
    }

    private void doCapture(Consumer<String> onFailure) {
        int nativeRate = props.getNativeSampleRate();
        int bytesPerRead = Math.max(2, (nativeRate * 2 * props.getReadChunkMillis() / 1000) & ~1);
        TargetDataLine line = null;
        long captured = 0;
        boolean overflowReported = false;
        try {
            line = provider.open(AudioFormat.captureFormat(nativeRate), Optional.ofNullable(props.getDeviceName()));
            line.start();
            byte[] buf = new byte[bytesPerRead];
            while (active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 1) {
                    continue;
                }
                float[] samples = PcmQuantizer.fromPcm16le(buf, n);
                byte[] pcm = PcmQuantizer.toLittleEndianBytes(
                        PcmQuantizer.toPcm16(resampler.resample(samples, nativeRate)));
                int dropped = accumulator.append(pcm, 0, pcm.length);
                captured += pcm.length;
                if (dropped > 0 && !overflowReported) {
                    overflowReported = true;
                    LOG.warn("Audio capture '{}' buffer full: oldest audio is being dropped ({} bytes so far)",
                            owner, accumulator.droppedBytes());
                    publisher.publishEvent(new CaptureErrorEvent(BUFFER_OVERFLOW, owner, Instant.now()));
                }
            }
            LOG.debug("Audio capture '{}' finished: {} wire bytes, {} dropped",
                    owner, captured, accumulator.droppedBytes());
        } catch (LineUnavailableException e) {
            fail("MIC_UNAVAILABLE", e, onFailure);
        } catch (SecurityException e) {
            fail("MIC_PERMISSION_DENIED", e, onFailure);
        } catch (RuntimeException e) {
            fail("CAPTURE_ERROR", e, onFailure);
        } finally {
            closeQuietly(line);
        }
    }

    private void fail(String reason, Exception e, Consumer<String> onFailure) {
        LOG.warn("Audio capture '{}' failed: reason={}, error={}", owner, reason, e.toString());
        active.set(false);
        publisher.publishEvent(new CaptureErrorEvent(reason, owner, Instant.now()));
        onFailure.accept(reason);
    }

    private static void closeQuietly(TargetDataLine line) {
        if (line == null) {
            return;
        }
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing capture line failed: {}", e.toString());
        }
    }

    @Override
    public Optional<AudioFrame> drain() {
        byte[] pcm = accumulator.drain();
        if (pcm.length == 0) {
            return Optional.empty();
        }
        return Optional.of(new AudioFrame(pcm, Instant.now()));
    }

    @Override
    public void discard() {
        accumulator.clear();
    }

    @Override
    public void stop() {
        Thread captureThread;
        MicrophoneToken held;
        synchronized (lock) {
            active.set(false);
            captureThread = thread;
            held = token;
            thread = null;
            token = null;
        }
        // Join outside the lock so a failing capture thread can still finish.
        joinThread(captureThread, RelayTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        microphones.release(held);
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    private void joinThread(Thread t, long timeoutMs) {
        if (t == null || !t.isAlive() || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(timeoutMs);
            if (t.isAlive()) {
                LOG.warn("Capture thread '{}' did not terminate within {}ms", owner, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread '{}' to terminate", owner);
        }
    }
}

package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.config.engine.EngineProperties;
import com.phillippitts.scriberelay.domain.TranscriptFragment;
import com.phillippitts.scriberelay.exception.ScribeRelayException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NativeRecognizer} backed by a Vosk model.
 *
 * <p>The model is loaded on first use and shared; a recognizer is created per stream since
 * Vosk recognizers are not thread-safe.
 */
@Component
public class VoskNativeRecognizer implements NativeRecognizer {

    private static final Logger LOG = LogManager.getLogger(VoskNativeRecognizer.class);

    private final EngineProperties.Native props;
    private final Object lock = new Object();
    private org.vosk.Model model;

    public VoskNativeRecognizer(EngineProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null").getNative();
    }

    @Override
    public boolean isAvailable() {
        return props.isEnabled()
                && props.getModelPath() != null
                && Files.isDirectory(Paths.get(props.getModelPath()));
    }

    @Override
    public Session open(int sampleRate) {
        try {
            return new VoskSession(new org.vosk.Recognizer(model(), sampleRate));
        } catch (ScribeRelayException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            throw new ScribeRelayException("Failed to open Vosk recognizer", e);
        }
    }

    private org.vosk.Model model() {
        synchronized (lock) {
            if (model == null) {
                LOG.info("Loading Vosk model: path={}", props.getModelPath());
                try {
                    model = new org.vosk.Model(props.getModelPath());
                } catch (Exception | LinkageError e) {
                    throw new ScribeRelayException("Failed to load Vosk model", e);
                }
            }
            return model;
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            if (model != null) {
                try {
                    model.close();
                } catch (RuntimeException e) {
                    LOG.warn("Error closing Vosk model", e);
                }
                model = null;
            }
        }
    }

    /** Reads one text field of a Vosk JSON result; blank or unreadable results read as empty. */
    static String textOf(String json, String field) {
        if (json == null || json.isBlank()) {
            return "";
        }
        try {
            return new JSONObject(json).optString(field, "").trim();
        } catch (JSONException e) {
            LOG.debug("Unreadable Vosk result ({} chars)", json.length());
            return "";
        }
    }

    private static final class VoskSession implements Session {

        private final org.vosk.Recognizer recognizer;

        VoskSession(org.vosk.Recognizer recognizer) {
            this.recognizer = recognizer;
        }

        @Override
        public Optional<TranscriptFragment> accept(byte[] pcm) {
            if (recognizer.acceptWaveForm(pcm, pcm.length)) {
                String text = textOf(recognizer.getResult(), "text");
                return text.isEmpty() ? Optional.empty() : Optional.of(TranscriptFragment.fin(text, true));
            }
            String partial = textOf(recognizer.getPartialResult(), "partial");
            return partial.isEmpty() ? Optional.empty() : Optional.of(TranscriptFragment.partial(partial));
        }

        @Override
        public Optional<TranscriptFragment> finish() {
            String text = textOf(recognizer.getFinalResult(), "text");
            return text.isEmpty() ? Optional.empty() : Optional.of(TranscriptFragment.fin(text, true));
        }

        @Override
        public void close() {
            recognizer.close();
        }
    }
}

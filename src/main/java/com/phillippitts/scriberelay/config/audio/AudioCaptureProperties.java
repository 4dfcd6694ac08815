package com.phillippitts.scriberelay.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture and frame flushing.
 *
 * The line is opened at {@code nativeSampleRate} and resampled to the 16 kHz wire format.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    @Min(8_000)
    @Max(192_000)
    private final int nativeSampleRate;

    /** Size of one TargetDataLine read, in milliseconds. */
    @Min(10)
    @Max(200)
    private final int readChunkMillis;

    /** Flush interval of the low-latency streaming engines. */
    @Min(20)
    @Max(1_000)
    private final int streamingFlushMillis;

    /** Flush interval of the chunk upload engine. */
    @Min(1_000)
    @Max(30_000)
    private final int chunkFlushMillis;

    /** Audio held while nobody drains the buffer; older samples are overwritten. */
    @Min(1_000)
    @Max(600_000)
    private final int maxBufferMillis;

    /** Optional input device name hint; falls back to the system default when null or blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("48000") int nativeSampleRate,
                                  @DefaultValue("20") int readChunkMillis,
                                  @DefaultValue("100") int streamingFlushMillis,
                                  @DefaultValue("5000") int chunkFlushMillis,
                                  @DefaultValue("30000") int maxBufferMillis,
                                  String deviceName) {
        this.nativeSampleRate = nativeSampleRate;
        this.readChunkMillis = readChunkMillis;
        this.streamingFlushMillis = streamingFlushMillis;
        this.chunkFlushMillis = chunkFlushMillis;
        this.maxBufferMillis = maxBufferMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getNativeSampleRate() { return nativeSampleRate; }
    public int getReadChunkMillis() { return readChunkMillis; }
    public int getStreamingFlushMillis() { return streamingFlushMillis; }
    public int getChunkFlushMillis() { return chunkFlushMillis; }
    public int getMaxBufferMillis() { return maxBufferMillis; }
    public String getDeviceName() { return deviceName; }
}

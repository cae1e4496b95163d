package com.phillippitts.huevoice.testutil;

import com.phillippitts.huevoice.service.audio.capture.AudioInput;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Audio input fed from a script of chunk amplitudes. Each read fills the buffer with a square wave
 * of the next scripted amplitude; once the script runs out it reads silence.
 */
public class ScriptedAudioInput implements AudioInput {

    private final Deque<Integer> amplitudes = new ArrayDeque<>();
    private final AtomicInteger discards = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger reads = new AtomicInteger();

    /** Appends {@code count} chunks at {@code amplitude}. */
    public synchronized ScriptedAudioInput then(int amplitude, int count) {
        for (int i = 0; i < count; i++) {
            amplitudes.addLast(amplitude);
        }
        return this;
    }

    public int discards() {
        return discards.get();
    }

    public int reads() {
        return reads.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public int read(byte[] buffer) {
        reads.incrementAndGet();
        Integer amplitude;
        synchronized (this) {
            amplitude = amplitudes.pollFirst();
        }
        fill(buffer, amplitude == null ? 0 : amplitude);
        return buffer.length;
    }

    @Override
    public void discardBuffered() {
        discards.incrementAndGet();
    }

    @Override
    public void close() {
        closed.set(true);
    }

    /** Square wave: alternating +amplitude and -amplitude samples, so RMS equals amplitude. */
    public static void fill(byte[] buffer, int amplitude) {
        if (amplitude == 0) {
            Arrays.fill(buffer, (byte) 0);
            return;
        }
        for (int i = 0; i + 1 < buffer.length; i += 2) {
            int sample = (i / 2) % 2 == 0 ? amplitude : -amplitude;
            buffer[i] = (byte) (sample & 0xFF);
            buffer[i + 1] = (byte) ((sample >> 8) & 0xFF);
        }
    }
}

package com.phillippitts.huevoice.testutil;

import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.service.recognition.RecognitionResponse;
import com.phillippitts.huevoice.service.recognition.RecognitionService;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Recognition service answering from a queue of scripted responses. Each script entry is either a
 * response or a thrown exception; an empty queue answers "turn on" with full confidence.
 */
public class FakeRecognitionService implements RecognitionService {

    private final Deque<Supplier<RecognitionResponse>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();

    public FakeRecognitionService thenReturn(String text, double confidence) {
        RecognitionResponse response = new RecognitionResponse(
                List.of(new RecognitionResponse.Alternative(text, confidence)));
        synchronized (script) {
            script.addLast(() -> response);
        }
        return this;
    }

    public FakeRecognitionService thenThrow(RuntimeException e) {
        synchronized (script) {
            script.addLast(() -> {
                throw e;
            });
        }
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public RecognitionResponse recognize(AudioClip clip) {
        calls.incrementAndGet();
        Supplier<RecognitionResponse> next;
        synchronized (script) {
            next = script.pollFirst();
        }
        if (next == null) {
            return new RecognitionResponse(List.of(new RecognitionResponse.Alternative("turn on", 1.0)));
        }
        return next.get();
    }
}

package com.phillippitts.huevoice.service.recognition;

import java.util.List;

/**
 * Ranked recognition alternatives, best first.
 */
public record RecognitionResponse(List<Alternative> alternatives) {

    /**
     * @param text       recognized text
     * @param confidence 0.0 to 1.0; services that omit it report 1.0
     */
    public record Alternative(String text, double confidence) {
    }

    public RecognitionResponse {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("alternatives must not be empty");
        }
        alternatives = List.copyOf(alternatives);
    }

    public Alternative best() {
        return alternatives.get(0);
    }
}

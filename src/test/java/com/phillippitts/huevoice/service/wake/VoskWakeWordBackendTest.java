package com.phillippitts.huevoice.service.wake;

import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoskWakeWordBackendTest {

    @Test
    void shouldMatchConfidentKeyword() {
        String json = "{\"result\":[{\"conf\":0.93,\"word\":\"philips\"}],\"text\":\"philips\"}";

        assertThat(VoskWakeWordBackend.matches(json, "philips", 0.5)).isTrue();
    }

    @Test
    void shouldRejectLowConfidenceWord() {
        String json = "{\"result\":[{\"conf\":0.31,\"word\":\"philips\"}],\"text\":\"philips\"}";

        assertThat(VoskWakeWordBackend.matches(json, "philips", 0.5)).isFalse();
    }

    @Test
    void shouldRejectUnknownSpeech() {
        assertThat(VoskWakeWordBackend.matches("{\"text\":\"[unk]\"}", "philips", 0.5)).isFalse();
        assertThat(VoskWakeWordBackend.matches("{\"text\":\"\"}", "philips", 0.5)).isFalse();
    }

    @Test
    void shouldRequireEveryWordOfMultiWordKeyword() {
        String json = "{\"result\":[{\"conf\":0.9,\"word\":\"hey\"},{\"conf\":0.4,\"word\":\"lights\"}],"
                + "\"text\":\"hey lights\"}";

        assertThat(VoskWakeWordBackend.matches(json, "hey lights", 0.5)).isFalse();
        assertThat(VoskWakeWordBackend.matches(json, "hey lights", 0.3)).isTrue();
    }

    @Test
    void shouldTreatGarbageAsNoMatch() {
        assertThat(VoskWakeWordBackend.matches("not json", "philips", 0.5)).isFalse();
    }

    @Test
    void shouldReportMissingModelAsUnavailable(@TempDir Path dir) {
        WakeWordProperties props = new WakeWordProperties("philips", null, null,
                dir.resolve("no-model").toString(), null);
        VoskWakeWordBackend backend = new VoskWakeWordBackend(props);

        assertThatThrownBy(() -> backend.create("philips", 0.5))
                .isInstanceOfSatisfying(WakeWordUnavailableException.class,
                        e -> assertThat(e.getAttemptedKeywords()).containsExactly("philips"))
                .hasRootCauseMessage("Vosk model not found at " + dir.resolve("no-model").toAbsolutePath());
    }

    @Test
    void shouldRejectKeywordOutsideModelVocabulary(@TempDir Path dir) throws Exception {
        writeWords(dir, "<eps> 0", "computer 1", "philips 2");
        VoskWakeWordBackend backend = new VoskWakeWordBackend(
                new WakeWordProperties("jarvis", null, null, dir.toString(), null));

        assertThatThrownBy(() -> backend.create("Jarvis", 0.5))
                .isInstanceOfSatisfying(WakeWordUnavailableException.class,
                        e -> assertThat(e.getAttemptedKeywords()).containsExactly("Jarvis"))
                .hasRootCauseMessage("'jarvis' is not in the model vocabulary");
    }

    @Test
    void shouldRejectMultiWordKeywordWithOneUnknownWord(@TempDir Path dir) throws Exception {
        writeWords(dir, "hey 1", "lights 2");
        VoskWakeWordBackend backend = new VoskWakeWordBackend(
                new WakeWordProperties("hey lumo", null, null, dir.toString(), null));

        assertThatThrownBy(() -> backend.create("hey lumo", 0.5))
                .isInstanceOf(WakeWordUnavailableException.class)
                .hasRootCauseMessage("'lumo' is not in the model vocabulary");
    }

    @Test
    void shouldReadFirstColumnOfWordList(@TempDir Path dir) throws Exception {
        writeWords(dir, "<eps> 0", "computer 1", "", "  philips   2  ");

        assertThat(VoskWakeWordBackend.loadVocabulary(dir))
                .hasValueSatisfying(words -> assertThat(words).containsExactlyInAnyOrder("<eps>", "computer", "philips"));
    }

    @Test
    void shouldSkipVocabularyCheckWhenModelHasNoWordList(@TempDir Path dir) throws Exception {
        assertThat(VoskWakeWordBackend.loadVocabulary(dir)).isEmpty();
    }

    private static void writeWords(Path modelDir, String... lines) throws IOException {
        Path words = modelDir.resolve(VoskWakeWordBackend.WORDS_FILE);
        Files.createDirectories(words.getParent());
        Files.write(words, List.of(lines));
    }
}

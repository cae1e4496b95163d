package com.phillippitts.huevoice.service.wake;

import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import com.phillippitts.huevoice.service.audio.AudioFormat;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.vosk.Model;
import org.vosk.Recognizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Offline keyword spotting on a Vosk model.
 *
 * <p>Each detector runs a recognizer restricted to a two-entry grammar: the keyword and {@code [unk]}.
 * A final result whose words spell the keyword, each with confidence at least
 * {@code 1 - sensitivity}, counts as a detection. A keyword with a word outside the model's
 * vocabulary ({@code graph/words.txt}) is unavailable.
 *
 * <p>The model is loaded on first use and shared by all detectors.
 */
@Component
public class VoskWakeWordBackend implements WakeWordBackend {

    private static final Logger LOG = LogManager.getLogger(VoskWakeWordBackend.class);

    static final String WORDS_FILE = "graph/words.txt";

    private final WakeWordProperties props;
    private final Object lock = new Object();
    // @GuardedBy("lock")
    private Model model;
    // @GuardedBy("lock"); empty when the model ships no word list
    private Optional<Set<String>> vocabulary;

    public VoskWakeWordBackend(WakeWordProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public WakeWordHandle create(String keyword, double sensitivity) {
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        Path path = modelDirectory(keyword);
        vocabulary(path, keyword).ifPresent(words -> {
            for (String word : normalized.split("\\s+")) {
                if (!words.contains(word)) {
                    throw new WakeWordUnavailableException(List.of(keyword),
                            new IllegalArgumentException("'" + word + "' is not in the model vocabulary"));
                }
            }
        });
        Model m = model(path, keyword);
        try {
            Recognizer recognizer = new Recognizer(m, (float) AudioFormat.SAMPLE_RATE);
            recognizer.setWords(true);
            recognizer.setGrammar(new JSONArray(List.of(normalized, "[unk]")).toString());
            LOG.info("Wake word '{}' loaded (sensitivity={})", normalized, sensitivity);
            return new VoskDetector(normalized, recognizer, 1.0 - sensitivity);
        } catch (IOException e) {
            throw new WakeWordUnavailableException(List.of(keyword), e);
        }
    }

    private Path modelDirectory(String keyword) {
        Path path = Path.of(props.getModelPath());
        if (!Files.isDirectory(path)) {
            throw new WakeWordUnavailableException(List.of(keyword),
                    new IOException("Vosk model not found at " + path.toAbsolutePath()));
        }
        return path;
    }

    private Optional<Set<String>> vocabulary(Path path, String keyword) {
        synchronized (lock) {
            if (vocabulary == null) {
                try {
                    vocabulary = loadVocabulary(path);
                } catch (IOException e) {
                    throw new WakeWordUnavailableException(List.of(keyword), e);
                }
                if (vocabulary.isEmpty()) {
                    LOG.warn("Model at {} has no {}; wake word vocabulary is not checked", path, WORDS_FILE);
                }
            }
            return vocabulary;
        }
    }

    /**
     * Reads {@code graph/words.txt}, one {@code <word> <id>} pair per line.
     *
     * @return the model's words, empty when the model has no word list
     */
    static Optional<Set<String>> loadVocabulary(Path modelDir) throws IOException {
        Path words = modelDir.resolve(WORDS_FILE);
        if (!Files.isRegularFile(words)) {
            return Optional.empty();
        }
        Set<String> result = new HashSet<>();
        try (Stream<String> lines = Files.lines(words, StandardCharsets.UTF_8)) {
            lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> line.split("\\s+", 2)[0])
                    .forEach(result::add);
        }
        return Optional.of(Set.copyOf(result));
    }

    private Model model(Path path, String keyword) {
        synchronized (lock) {
            if (model == null) {
                try {
                    model = new Model(path.toString());
                    LOG.info("Loaded wake word model from {}", path);
                } catch (IOException | RuntimeException | UnsatisfiedLinkError e) {
                    throw new WakeWordUnavailableException(List.of(keyword), e);
                }
            }
            return model;
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            if (model != null) {
                model.close();
                model = null;
            }
        }
    }

    /**
     * @return true when every recognized word matches the keyword with enough confidence
     */
    static boolean matches(String resultJson, String keyword, double minConfidence) {
        try {
            JSONObject result = new JSONObject(resultJson);
            if (!keyword.equals(result.optString("text", "").trim())) {
                return false;
            }
            JSONArray words = result.optJSONArray("result");
            if (words == null) {
                return true;
            }
            for (int i = 0; i < words.length(); i++) {
                if (words.getJSONObject(i).optDouble("conf", 1.0) < minConfidence) {
                    return false;
                }
            }
            return true;
        } catch (JSONException e) {
            LOG.debug("Unparseable wake word result: {}", e.getMessage());
            return false;
        }
    }

    private static final class VoskDetector implements WakeWordHandle {

        private final String keyword;
        private final Recognizer recognizer;
        private final double minConfidence;

        VoskDetector(String keyword, Recognizer recognizer, double minConfidence) {
            this.keyword = keyword;
            this.recognizer = recognizer;
            this.minConfidence = minConfidence;
        }

        @Override
        public String keyword() {
            return keyword;
        }

        @Override
        public OptionalInt processFrame(byte[] frame, int length) {
            if (recognizer.acceptWaveForm(frame, length) && matches(recognizer.getResult(), keyword, minConfidence)) {
                return OptionalInt.of(0);
            }
            return OptionalInt.empty();
        }

        @Override
        public void close() {
            recognizer.close();
        }
    }
}

package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.config.properties.CommandAliasProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable table of canonical action, spoken aliases and handler.
 *
 * <p>Built once at startup. Exact lookup scans actions in {@link ActionType} order and matches a
 * phrase only on word boundaries, so "on" does not fire inside "lONg". Fuzzy lookup scores the
 * query against every phrase, ignoring filler words such as "the" and "lights", and accepts the best
 * one strictly above the threshold.
 */
public final class ActionRegistry {

    private static final Logger LOG = LogManager.getLogger(ActionRegistry.class);

    /**
     * Words every command shares. Left in, "kill the lights" would score 80 against "lights on".
     */
    static final Set<String> FUZZY_IGNORED = Set.of("the", "a", "my", "light", "lights", "lamp", "lamps", "please");

    /** Result of a successful lookup. */
    public record Match(ActionType action, String phrase, int score) {
    }

    private final Map<ActionType, List<String>> phrases;
    private final Map<ActionType, LightAction> handlers;
    private final List<Pattern> undoPatterns;
    private final Map<String, Pattern> phrasePatterns;
    private final int fuzzyThreshold;

    public ActionRegistry(CommandAliasProperties aliases, Map<ActionType, LightAction> handlers, int fuzzyThreshold) {
        Objects.requireNonNull(aliases, "aliases");
        Map<ActionType, List<String>> table = new LinkedHashMap<>();
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (ActionType type : ActionType.values()) {
            Set<String> all = new LinkedHashSet<>();
            all.add(type.canonical());
            for (String alias : aliases.aliasesFor(type.canonical())) {
                all.add(alias.trim().toLowerCase(Locale.ROOT));
            }
            table.put(type, List.copyOf(all));
            all.forEach(p -> patterns.computeIfAbsent(p, ActionRegistry::wordPattern));
        }
        EnumMap<ActionType, LightAction> bound = new EnumMap<>(ActionType.class);
        bound.putAll(handlers);
        for (ActionType type : ActionType.values()) {
            if (!bound.containsKey(type)) {
                throw new IllegalArgumentException("No handler registered for " + type);
            }
        }
        List<Pattern> undo = new ArrayList<>();
        undo.add(wordPattern("undo"));
        for (String alias : aliases.getUndoAliases()) {
            undo.add(wordPattern(alias.trim().toLowerCase(Locale.ROOT)));
        }

        this.phrases = Collections.unmodifiableMap(table);
        this.handlers = Collections.unmodifiableMap(bound);
        this.undoPatterns = List.copyOf(undo);
        this.phrasePatterns = Collections.unmodifiableMap(patterns);
        this.fuzzyThreshold = fuzzyThreshold;
        LOG.info("Action registry loaded: {} actions, {} phrases, {} undo phrases, fuzzy threshold {}",
                table.size(), patterns.size(), undo.size(), fuzzyThreshold);
    }

    /** @return true when the text contains "undo" or an undo alias as whole words */
    public boolean isUndo(String text) {
        return undoPatterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    /**
     * First action (in table order) with a phrase appearing in the text as whole words.
     */
    public Optional<Match> matchExact(String text) {
        for (Map.Entry<ActionType, List<String>> entry : phrases.entrySet()) {
            for (String phrase : entry.getValue()) {
                if (phrasePatterns.get(phrase).matcher(text).find()) {
                    return Optional.of(new Match(entry.getKey(), phrase, 100));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Best fuzzy match over all phrases, accepted only when its score exceeds the threshold.
     * Ties keep the earlier phrase.
     */
    public Optional<Match> matchFuzzy(String text) {
        Match best = null;
        for (Map.Entry<ActionType, List<String>> entry : phrases.entrySet()) {
            for (String phrase : entry.getValue()) {
                int score = FuzzyMatcher.tokenSetScore(text, phrase, FUZZY_IGNORED);
                if (score > fuzzyThreshold && (best == null || score > best.score())) {
                    best = new Match(entry.getKey(), phrase, score);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public LightAction handler(ActionType type) {
        return handlers.get(type);
    }

    /** @return canonical phrase followed by aliases */
    public List<String> phrases(ActionType type) {
        return phrases.get(type);
    }

    private static Pattern wordPattern(String phrase) {
        String body = Pattern.quote(phrase).replace(" ", "\\E\\s+\\Q");
        return Pattern.compile("(?<![\\p{Alnum}])" + body + "(?![\\p{Alnum}])");
    }
}

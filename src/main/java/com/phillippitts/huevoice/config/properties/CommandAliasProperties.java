package com.phillippitts.huevoice.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spoken alias table. Keys of {@code aliases} are canonical action names ("turn on", "dim", ...);
 * a canonical action missing from configuration keeps its built-in aliases.
 */
@ConfigurationProperties(prefix = "commands")
public class CommandAliasProperties {

    private static final Map<String, List<String>> DEFAULT_ALIASES = defaultAliases();
    private static final List<String> DEFAULT_UNDO_ALIASES = List.of("revert", "go back", "previous", "cancel");

    private final Map<String, List<String>> aliases;
    private final List<String> undoAliases;

    @ConstructorBinding
    public CommandAliasProperties(Map<String, List<String>> aliases, List<String> undoAliases) {
        Map<String, List<String>> merged = new LinkedHashMap<>(DEFAULT_ALIASES);
        if (aliases != null) {
            aliases.forEach((canonical, list) -> merged.put(canonical.trim(), List.copyOf(list)));
        }
        this.aliases = Map.copyOf(merged);
        this.undoAliases = undoAliases == null || undoAliases.isEmpty()
                ? DEFAULT_UNDO_ALIASES
                : List.copyOf(undoAliases);
    }

    public static CommandAliasProperties defaults() {
        return new CommandAliasProperties(null, null);
    }

    /**
     * @param canonical canonical action name
     * @return configured aliases, empty when none are known
     */
    public List<String> aliasesFor(String canonical) {
        return aliases.getOrDefault(canonical, List.of());
    }

    public List<String> getUndoAliases() {
        return undoAliases;
    }

    private static Map<String, List<String>> defaultAliases() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("turn on", List.of("lights on", "switch on", "power on", "on", "activate lights"));
        m.put("turn off", List.of("lights off", "switch off", "power off", "off", "deactivate lights"));
        m.put("dim", List.of("lower", "darker", "reduce brightness", "less bright", "dimmer"));
        m.put("brighten", List.of("brighter", "increase", "more light", "lighter", "more brightness"));
        m.put("maximum", List.of("brightest", "full", "hundred percent", "max brightness"));
        m.put("minimum", List.of("dimmest", "low", "lowest", "min brightness"));
        return m;
    }
}

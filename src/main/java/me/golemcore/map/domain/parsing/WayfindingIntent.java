package me.golemcore.map.domain.parsing;

import java.util.List;
import java.util.Locale;

/**
 * Detects explicit "move the map" vocabulary in a text.
 */
final class WayfindingIntent {

    private static final List<String> VERBS = List.of("navigate", "go to", "show me", "take me");

    private WayfindingIntent() {
    }

    static boolean isPresent(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return VERBS.stream().anyMatch(lower::contains);
    }
}

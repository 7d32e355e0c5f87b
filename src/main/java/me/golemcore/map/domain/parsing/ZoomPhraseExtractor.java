package me.golemcore.map.domain.parsing;

import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolCallOrigin;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Explicit numeric zoom requests ("zoom to 10", "zoom 5", "zoom level to 8",
 * "set level to 3", "zoom to level 12"). The level is passed through as
 * written; clamping happens when the tool runs.
 */
public class ZoomPhraseExtractor implements TextToolCallExtractor {

    private static final List<Pattern> ZOOM_PATTERNS = List.of(
            Pattern.compile("zoom\\s*(?:to\\s*)?(\\d+)"),
            Pattern.compile("(?:zoom|set)\\s+level\\s*(?:to)?\\s*(\\d+)"),
            Pattern.compile("zoom\\s+(?:in\\s+|out\\s+)?to\\s+level\\s+(\\d+)"));

    @Override
    public Optional<Message.ToolCall> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : ZOOM_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                Optional<Number> level = parseLevel(matcher.group(1));
                if (level.isPresent()) {
                    return Optional.of(Message.ToolCall.builder()
                            .name(MapToolNames.ZOOM_TO_LEVEL)
                            .arguments(Map.of(MapToolNames.PARAM_ZOOM_LEVEL, level.get()))
                            .origin(ToolCallOrigin.TEXT_EXTRACTED)
                            .build());
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Number> parseLevel(String digits) {
        try {
            long value = Long.parseLong(digits);
            if (value <= Integer.MAX_VALUE) {
                return Optional.of((int) value);
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            // longer than a long can hold
            return Optional.empty();
        }
    }
}

package me.golemcore.map.domain.parsing;

import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolCallOrigin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "go to 40.7, -74.0" style requests. Only the first two numbers are
 * considered, read as latitude then longitude, and the pair is dropped when
 * either is out of range.
 */
public class CoordinatePairExtractor implements TextToolCallExtractor {

    // Two complete numbers; a single number is never split into a pair.
    private static final Pattern COORDINATE_PAIR = Pattern.compile(
            "(?<![\\d.])(-?\\d+(?:\\.\\d+)?)[^-\\d.]+(-?\\d+(?:\\.\\d+)?)(?!\\.?\\d)");

    @Override
    public Optional<Message.ToolCall> extract(String text) {
        if (!WayfindingIntent.isPresent(text)) {
            return Optional.empty();
        }
        Matcher matcher = COORDINATE_PAIR.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(matcher.group(1));
            longitude = Double.parseDouble(matcher.group(2));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            return Optional.empty();
        }

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(MapToolNames.PARAM_LATITUDE, latitude);
        arguments.put(MapToolNames.PARAM_LONGITUDE, longitude);
        return Optional.of(Message.ToolCall.builder()
                .name(MapToolNames.NAVIGATE_TO_LOCATION)
                .arguments(arguments)
                .origin(ToolCallOrigin.TEXT_EXTRACTED)
                .build());
    }
}

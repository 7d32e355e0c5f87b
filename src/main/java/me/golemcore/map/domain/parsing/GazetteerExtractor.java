package me.golemcore.map.domain.parsing;

import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolCallOrigin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * "navigate to Paris" style requests: a wayfinding verb plus a known place
 * name becomes a {@code navigate_to_location} call.
 */
public class GazetteerExtractor implements TextToolCallExtractor {

    private final Gazetteer gazetteer;

    public GazetteerExtractor(Gazetteer gazetteer) {
        this.gazetteer = gazetteer;
    }

    @Override
    public Optional<Message.ToolCall> extract(String text) {
        if (!WayfindingIntent.isPresent(text)) {
            return Optional.empty();
        }
        return gazetteer.findIn(text).map(place -> {
            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put(MapToolNames.PARAM_LATITUDE, place.latitude());
            arguments.put(MapToolNames.PARAM_LONGITUDE, place.longitude());
            return Message.ToolCall.builder()
                    .name(MapToolNames.NAVIGATE_TO_LOCATION)
                    .arguments(arguments)
                    .origin(ToolCallOrigin.TEXT_EXTRACTED)
                    .build();
        });
    }
}

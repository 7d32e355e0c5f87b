package me.golemcore.map.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.parsing.CoordinatePairExtractor;
import me.golemcore.map.domain.parsing.Gazetteer;
import me.golemcore.map.domain.parsing.GazetteerExtractor;
import me.golemcore.map.domain.parsing.JsonToolCallDecoder;
import me.golemcore.map.domain.parsing.ResponseNormalizer;
import me.golemcore.map.domain.parsing.ZoomPhraseExtractor;
import me.golemcore.map.domain.service.MapToolDispatcher;
import me.golemcore.map.domain.service.RuntimeEventService;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;

@Configuration
public class ToolLoopConfiguration {

    @Bean
    public Gazetteer gazetteer(ResourceLoader resourceLoader, MapAgentProperties properties,
            ObjectMapper objectMapper) {
        String location = properties.getGazetteer().getLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return Gazetteer.load(in, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load gazetteer from " + location, e);
        }
    }

    @Bean
    public ResponseNormalizer responseNormalizer(ObjectMapper objectMapper, Gazetteer gazetteer) {
        JsonToolCallDecoder decoder = new JsonToolCallDecoder(objectMapper, MapToolNames.ALL);
        // Order is priority: first match wins.
        return new ResponseNormalizer(objectMapper, decoder, List.of(
                new GazetteerExtractor(gazetteer),
                new CoordinatePairExtractor(),
                new ZoomPhraseExtractor()));
    }

    @Bean
    public ToolExecutorPort toolExecutorPort(MapToolDispatcher dispatcher) {
        return new DispatcherToolExecutor(dispatcher);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ResponseNormalizer responseNormalizer, RuntimeEventService runtimeEvents,
            MapToolDispatcher dispatcher, MapAgentProperties properties) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, responseNormalizer,
                runtimeEvents, dispatcher::getToolDefinitions, properties.getLlm(), properties.getToolLoop());
    }
}

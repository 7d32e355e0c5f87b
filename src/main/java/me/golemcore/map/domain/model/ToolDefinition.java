package me.golemcore.map.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Name, description and JSON-schema parameters of a tool as advertised to the
 * LLM.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Property schemas keyed by parameter name, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getProperties() {
        if (inputSchema == null || !(inputSchema.get("properties") instanceof Map)) {
            return Map.of();
        }
        return (Map<String, Object>) inputSchema.get("properties");
    }

    @SuppressWarnings("unchecked")
    public List<String> getRequired() {
        if (inputSchema == null || !(inputSchema.get("required") instanceof List)) {
            return List.of();
        }
        return (List<String>) inputSchema.get("required");
    }
}

package io.cronkeeper.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry for tools offered to the host agent.
 *
 * <p>Each tool is registered with a description and a JSON schema and is exposed as a Spring AI
 * {@link ToolCallback}, so a {@code ChatClient} can hand it to the model directly.</p>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final Map<String, ToolCallback> callbacks = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a tool, replacing any tool of the same name.
     *
     * @param name        tool name
     * @param description human-readable description for the model
     * @param inputSchema JSON Schema string for the tool's parameters
     * @param tool        the tool implementation
     */
    public void register(String name, String description, String inputSchema, Tool tool) {
        tools.put(name, tool);
        callbacks.put(name, new ToolAdapter(name, description, inputSchema, this));
        log.debug("Registered tool: {}", name);
    }

    public List<ToolCallback> getToolCallbacks(List<String> toolNames) {
        List<ToolCallback> found = new ArrayList<>();
        for (String name : toolNames) {
            ToolCallback cb = callbacks.get(name);
            if (cb != null) {
                found.add(cb);
            } else {
                log.warn("Tool '{}' not found in registry", name);
            }
        }
        return found;
    }

    public List<ToolCallback> getAllToolCallbacks() {
        return new ArrayList<>(callbacks.values());
    }

    public List<String> getAllToolNames() {
        return new ArrayList<>(tools.keySet());
    }

    /**
     * Executes a tool by name.
     *
     * @param toolName  the tool to execute
     * @param arguments JSON object string of arguments, may be blank
     */
    public ToolResult executeTool(String toolName, String arguments) {
        Tool tool = tools.get(toolName);
        if (tool == null) {
            log.error("Tool '{}' not found", toolName);
            return ToolResult.error("Tool '" + toolName + "' not found.");
        }
        try {
            return tool.execute(parseArguments(arguments));
        } catch (RuntimeException e) {
            log.error("Error executing tool '{}': {}", toolName, e.getMessage(), e);
            return ToolResult.error(e.getMessage());
        }
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, new TypeReference<>() {});
        } catch (Exception e) {
            log.warn("Failed to parse tool arguments: {}", arguments, e);
            return Map.of();
        }
    }

    @FunctionalInterface
    public interface Tool {
        ToolResult execute(Map<String, Object> arguments);
    }

    /**
     * Exposes a registered tool to Spring AI.
     */
    static class ToolAdapter implements ToolCallback {

        private final String name;
        private final String description;
        private final String inputSchema;
        private final ToolRegistry registry;

        ToolAdapter(String name, String description, String inputSchema, ToolRegistry registry) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
            this.registry = registry;
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build();
        }

        @Override
        public String call(String toolInput) {
            return registry.executeTool(name, toolInput).value();
        }
    }
}

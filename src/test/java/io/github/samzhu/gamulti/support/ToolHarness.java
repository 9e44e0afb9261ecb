package io.github.samzhu.gamulti.support;

import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import java.util.LinkedHashMap;
import java.util.Map;

import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.CallToolRequest;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;

/**
 * 從 mock 的 {@link McpSyncServer} 取出已註冊的工具並直接呼叫。
 */
public final class ToolHarness {

    private final ObjectMapper json;
    private final Map<String, SyncToolSpecification> tools = new LinkedHashMap<>();

    private ToolHarness(ObjectMapper json) {
        this.json = json;
    }

    /**
     * 與 application.yaml 相同設定的 ObjectMapper。
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static ToolHarness capture(McpSyncServer server, ObjectMapper json) {
        ArgumentCaptor<SyncToolSpecification> captor = ArgumentCaptor.forClass(SyncToolSpecification.class);
        verify(server, atLeastOnce()).addTool(captor.capture());
        ToolHarness harness = new ToolHarness(json);
        for (SyncToolSpecification spec : captor.getAllValues()) {
            harness.tools.put(spec.tool().name(), spec);
        }
        return harness;
    }

    public Map<String, SyncToolSpecification> tools() {
        return tools;
    }

    public CallToolResult call(String name, Map<String, Object> arguments) {
        SyncToolSpecification spec = tools.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Tool not registered: " + name);
        }
        return spec.callHandler().apply(null, new CallToolRequest(name, arguments));
    }

    public JsonNode body(CallToolResult result) throws JsonProcessingException {
        return json.readTree(((TextContent) result.content().get(0)).text());
    }
}

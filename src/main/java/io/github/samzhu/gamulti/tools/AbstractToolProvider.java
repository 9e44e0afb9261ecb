package io.github.samzhu.gamulti.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.exception.AnalyticsException;
import io.github.samzhu.gamulti.exception.ErrorKind;
import io.github.samzhu.gamulti.model.ErrorDetail;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.JsonSchema;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * 工具提供者的共用實作。
 *
 * <p>提供：
 * <ul>
 *   <li>JSON schema 與回應建立</li>
 *   <li>包裝後的工具註冊：任何例外都轉為 {@code {error_kind, message, hint}} 錯誤回應，不會逸出</li>
 *   <li>參數讀取，同時接受 snake_case 與 camelCase 名稱</li>
 * </ul>
 *
 * @see <a href="https://github.com/modelcontextprotocol/java-sdk">MCP Java SDK</a>
 */
public abstract class AbstractToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractToolProvider.class);

    protected final McpSyncServer server;
    protected final ObjectMapper json;
    protected final List<Tool> registeredTools = new ArrayList<>();

    /**
     * @param server MCP 伺服器
     * @param json 工具回應使用的 ObjectMapper（snake_case）
     */
    protected AbstractToolProvider(McpSyncServer server, ObjectMapper json) {
        this.server = server;
        this.json = json;
    }

    @Override
    public List<String> toolNames() {
        return registeredTools.stream().map(Tool::name).toList();
    }

    /**
     * 建立工具的輸入 schema。
     */
    protected JsonSchema createSchema(Map<String, Object> properties, List<String> required) {
        return new JsonSchema("object", new LinkedHashMap<>(properties), required, true, null, null);
    }

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    protected static Map<String, Object> integerProperty(String description) {
        return Map.of("type", "integer", "description", description);
    }

    protected static Map<String, Object> booleanProperty(String description) {
        return Map.of("type", "boolean", "description", description);
    }

    protected static Map<String, Object> stringArrayProperty(String description) {
        return Map.of("type", "array", "items", Map.of("type", "string"), "description", description);
    }

    protected CallToolResult createJsonResult(Object data) {
        try {
            return new CallToolResult(List.of(new TextContent(json.writeValueAsString(data))), false);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize tool result: {}", e.getMessage(), e);
            return createErrorResult(new ErrorDetail(ErrorKind.INTERNAL_ERROR,
                "Failed to serialize the tool result", "Retry the call; the server log has the details"));
        }
    }

    protected CallToolResult createErrorResult(ErrorDetail error) {
        String body;
        try {
            body = json.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error detail: {}", e.getMessage(), e);
            body = "{\"error_kind\":\"" + error.errorKind() + "\",\"message\":\"internal error\"}";
        }
        return new CallToolResult(List.of(new TextContent(body)), true);
    }

    /**
     * 註冊工具，並以統一的錯誤處理與日誌包裝處理函式。
     *
     * <p>錯誤對應：
     * <ul>
     *   <li>{@link AnalyticsException} → 該例外的 {@link ErrorKind}</li>
     *   <li>{@link IllegalArgumentException} → {@link ErrorKind#INVALID_ARGUMENT}</li>
     *   <li>其他例外 → {@link ErrorKind#INTERNAL_ERROR}，訊息不含內部細節</li>
     * </ul>
     *
     * @param tool 工具定義
     * @param handler 以參數 Map 產生回應的函式
     */
    protected void registerTool(Tool tool, Function<Map<String, Object>, CallToolResult> handler) {
        SyncToolSpecification spec = SyncToolSpecification.builder()
            .tool(tool)
            .callHandler((exchange, request) -> invoke(tool.name(), request.arguments(), handler))
            .build();
        server.addTool(spec);
        registeredTools.add(tool);
        log.info("Registered tool: {}", tool.name());
    }

    private CallToolResult invoke(String toolName, Map<String, Object> arguments,
                                  Function<Map<String, Object>, CallToolResult> handler) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = System.currentTimeMillis();
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        log.info("[{}] Tool call: {} args={}", requestId, toolName, args.keySet());
        try {
            CallToolResult result = handler.apply(args);
            log.info("[{}] Tool completed: {} error={} ({}ms)", requestId, toolName,
                Boolean.TRUE.equals(result.isError()), System.currentTimeMillis() - startTime);
            return result;
        } catch (AnalyticsException e) {
            log.warn("[{}] Tool {} failed: {} - {}", requestId, toolName, e.getKind(), e.getMessage());
            return createErrorResult(ErrorDetail.from(e));
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Tool {} rejected arguments: {}", requestId, toolName, e.getMessage());
            return createErrorResult(new ErrorDetail(ErrorKind.INVALID_ARGUMENT, e.getMessage(),
                "Check the tool's input schema for required parameters and formats"));
        } catch (RuntimeException e) {
            log.error("[{}] Tool {} failed unexpectedly ({}ms)", requestId, toolName,
                System.currentTimeMillis() - startTime, e);
            return createErrorResult(new ErrorDetail(ErrorKind.INTERNAL_ERROR,
                "Tool " + toolName + " failed with an internal error",
                "Retry the call; the server log has the details"));
        }
    }

    // ===== Parameter helpers =====

    /**
     * 依名稱取得參數，找不到時改試 snake_case / camelCase 的另一種寫法。
     */
    protected Object getParameterValue(Map<String, Object> args, String key) {
        if (args == null || key == null) {
            return null;
        }
        Object value = args.get(key);
        if (value != null) {
            return value;
        }
        if (key.contains("_")) {
            return args.get(snakeToCamel(key));
        }
        if (key.matches(".*[a-z][A-Z].*")) {
            return args.get(camelToSnake(key));
        }
        return null;
    }

    protected String getString(Map<String, Object> args, String key) {
        String value = getOptionalString(args, key, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return value;
    }

    protected String getOptionalString(Map<String, Object> args, String key, String defaultValue) {
        Object value = getParameterValue(args, key);
        return value == null ? defaultValue : value.toString();
    }

    protected Integer getOptionalInteger(Map<String, Object> args, String key, Integer defaultValue) {
        Object value = getParameterValue(args, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got: " + value);
        }
    }

    protected boolean getOptionalBoolean(Map<String, Object> args, String key, boolean defaultValue) {
        Object value = getParameterValue(args, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * 取得必填的字串清單；也接受以逗號分隔的單一字串。
     */
    protected List<String> getStringList(Map<String, Object> args, String key) {
        List<String> values = getOptionalStringList(args, key, List.of());
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return values;
    }

    protected List<String> getOptionalStringList(Map<String, Object> args, String key, List<String> defaultValue) {
        Object value = getParameterValue(args, key);
        if (value == null) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    /**
     * 取得物件清單參數，例如 filters。
     */
    @SuppressWarnings("unchecked")
    protected List<Map<String, Object>> getOptionalMapList(Map<String, Object> args, String key) {
        Object value = getParameterValue(args, key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Map<?, ?> single) {
            return List.of((Map<String, Object>) single);
        }
        if (value instanceof List<?> list) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw new IllegalArgumentException("Parameter '" + key + "' must be a list of objects");
                }
                result.add((Map<String, Object>) map);
            }
            return result;
        }
        throw new IllegalArgumentException("Parameter '" + key + "' must be a list of objects");
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> getOptionalMap(Map<String, Object> args, String key) {
        Object value = getParameterValue(args, key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Parameter '" + key + "' must be an object");
    }

    static String snakeToCamel(String snake) {
        StringBuilder sb = new StringBuilder();
        boolean upper = false;
        for (char c : snake.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    static String camelToSnake(String camel) {
        return camel.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}

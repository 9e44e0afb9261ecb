package io.github.samzhu.gamulti.tools;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.dto.tool.PropertyListResponse;
import io.github.samzhu.gamulti.dto.tool.PropertySearchResponse;
import io.github.samzhu.gamulti.service.FuzzyPropertyResolver;
import io.github.samzhu.gamulti.service.PropertyMetadataService;
import io.github.samzhu.gamulti.service.PropertyRegistry;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * Property 探索相關工具：list_properties、search_properties、get_property_metadata。
 */
public class PropertyToolProvider extends AbstractToolProvider {

    private static final int DEFAULT_MAX_RESULTS = 5;

    private final PropertyRegistry registry;
    private final FuzzyPropertyResolver resolver;
    private final PropertyMetadataService metadataService;

    public PropertyToolProvider(
            McpSyncServer server,
            ObjectMapper json,
            PropertyRegistry registry,
            FuzzyPropertyResolver resolver,
            PropertyMetadataService metadataService) {
        super(server, json);
        this.registry = registry;
        this.resolver = resolver;
        this.metadataService = metadataService;
    }

    @Override
    public void registerTools() {
        registerListProperties();
        registerSearchProperties();
        registerGetPropertyMetadata();
    }

    private void registerListProperties() {
        Tool tool = Tool.builder()
            .name("list_properties")
            .description("List all GA4 properties the service account can access, with their numeric IDs "
                + "and account names. Results are cached; pass force_refresh to rediscover.")
            .inputSchema(createSchema(
                Map.of("force_refresh", booleanProperty("Bypass the cached property list (default false)")),
                List.of()))
            .build();
        registerTool(tool, args -> createJsonResult(
            PropertyListResponse.from(registry.listProperties(getOptionalBoolean(args, "force_refresh", false)))));
    }

    private void registerSearchProperties() {
        Tool tool = Tool.builder()
            .name("search_properties")
            .description("Search GA4 properties by approximate name. Returns candidates ranked by confidence.")
            .inputSchema(createSchema(
                Map.of(
                    "query", stringProperty("Property name, partial name, alias or ID"),
                    "max_results", integerProperty("Maximum number of matches (default 5)")),
                List.of("query")))
            .build();
        registerTool(tool, args -> {
            String query = getString(args, "query");
            int maxResults = getOptionalInteger(args, "max_results", DEFAULT_MAX_RESULTS);
            return createJsonResult(PropertySearchResponse.from(query, resolver.search(query, maxResults)));
        });
    }

    private void registerGetPropertyMetadata() {
        Tool tool = Tool.builder()
            .name("get_property_metadata")
            .description("List the dimensions and metrics (including custom definitions) available for a property.")
            .inputSchema(createSchema(
                Map.of("property", stringProperty("Property name, alias or ID (fuzzy matching supported)")),
                List.of("property")))
            .build();
        registerTool(tool, args -> createJsonResult(metadataService.getMetadata(getString(args, "property"))));
    }
}

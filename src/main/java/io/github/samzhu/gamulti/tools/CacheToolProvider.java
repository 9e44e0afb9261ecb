package io.github.samzhu.gamulti.tools;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.dto.tool.CacheClearResponse;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * 快取管理工具：get_cache_status、clear_cache。
 */
public class CacheToolProvider extends AbstractToolProvider {

    private final TtlCache cache;

    public CacheToolProvider(McpSyncServer server, ObjectMapper json, TtlCache cache) {
        super(server, json);
        this.cache = cache;
    }

    @Override
    public void registerTools() {
        Tool status = Tool.builder()
            .name("get_cache_status")
            .description("Show cache entries with their age and TTL, plus hit and miss counters.")
            .inputSchema(createSchema(Map.of(), List.of()))
            .build();
        registerTool(status, args -> createJsonResult(cache.status()));

        Tool clear = Tool.builder()
            .name("clear_cache")
            .description("Clear cached entries. With a pattern only keys containing it are removed, "
                + "e.g. 'properties' for the property list or a property ID for its queries.")
            .inputSchema(createSchema(
                Map.of("pattern", stringProperty("Substring of the cache keys to remove (optional)")),
                List.of()))
            .build();
        registerTool(clear, args -> {
            String pattern = getOptionalString(args, "pattern", null);
            int removed = cache.invalidateMatching(pattern);
            return createJsonResult(CacheClearResponse.of(removed, pattern));
        });
    }
}

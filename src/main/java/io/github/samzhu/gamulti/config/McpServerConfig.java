package io.github.samzhu.gamulti.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.service.FuzzyPropertyResolver;
import io.github.samzhu.gamulti.service.PropertyMetadataService;
import io.github.samzhu.gamulti.service.PropertyRegistry;
import io.github.samzhu.gamulti.service.QueryOrchestrator;
import io.github.samzhu.gamulti.tools.CacheToolProvider;
import io.github.samzhu.gamulti.tools.McpToolRegistrar;
import io.github.samzhu.gamulti.tools.PropertyToolProvider;
import io.github.samzhu.gamulti.tools.QueryToolProvider;
import io.github.samzhu.gamulti.tools.ToolProvider;
import io.github.samzhu.gamulti.util.DateExpressionParser;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;

/**
 * MCP stdio 伺服器配置。
 *
 * <p>協定訊息使用獨立的 {@link ObjectMapper}（MCP 協定為 camelCase），
 * 工具回應則使用 Spring 的 ObjectMapper（snake_case，見 {@code application.yaml}）。
 *
 * <p>設定 {@code ga.mcp.enabled=false} 可停用（例如測試環境）。
 */
@Configuration
@ConditionalOnProperty(prefix = "ga.mcp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class McpServerConfig {

    private static final Logger log = LoggerFactory.getLogger(McpServerConfig.class);

    @Bean
    public StdioServerTransportProvider stdioServerTransportProvider() {
        return new StdioServerTransportProvider(new ObjectMapper());
    }

    @Bean
    public McpSyncServer mcpSyncServer(StdioServerTransportProvider transport, GaMultiProperties properties) {
        GaMultiProperties.McpConfig mcp = properties.mcp();
        log.info("Starting MCP server {} {} on stdio", mcp.serverName(), mcp.serverVersion());
        return McpServer.sync(transport)
            .serverInfo(mcp.serverName(), mcp.serverVersion())
            .capabilities(ServerCapabilities.builder().tools(true).build())
            .build();
    }

    @Bean
    public PropertyToolProvider propertyToolProvider(
            McpSyncServer server,
            ObjectMapper objectMapper,
            PropertyRegistry registry,
            FuzzyPropertyResolver resolver,
            PropertyMetadataService metadataService) {
        return new PropertyToolProvider(server, objectMapper, registry, resolver, metadataService);
    }

    @Bean
    public QueryToolProvider queryToolProvider(
            McpSyncServer server,
            ObjectMapper objectMapper,
            QueryOrchestrator orchestrator,
            DateExpressionParser dateParser,
            GaMultiProperties properties) {
        return new QueryToolProvider(server, objectMapper, orchestrator, dateParser, properties);
    }

    @Bean
    public CacheToolProvider cacheToolProvider(McpSyncServer server, ObjectMapper objectMapper, TtlCache cache) {
        return new CacheToolProvider(server, objectMapper, cache);
    }

    @Bean
    public McpToolRegistrar mcpToolRegistrar(McpSyncServer server, List<ToolProvider> providers) {
        return new McpToolRegistrar(server, providers);
    }
}

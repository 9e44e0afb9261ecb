package io.github.samzhu.gamulti.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.gamulti.cache.TtlCache;
import io.github.samzhu.gamulti.support.ToolHarness;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpSyncServer;

class McpToolRegistrarTest {

    private final McpSyncServer server = mock(McpSyncServer.class);
    private final CacheToolProvider cacheTools =
        new CacheToolProvider(server, ToolHarness.objectMapper(), new TtlCache(Clock.systemUTC(), 100));
    private final McpToolRegistrar registrar = new McpToolRegistrar(server, List.of(cacheTools));

    @Test
    void shouldRegisterToolsOnceOnStart() {
        // When
        registrar.start();
        registrar.start();

        // Then
        assertThat(registrar.isRunning()).isTrue();
        assertThat(registrar.toolNames()).containsExactly("get_cache_status", "clear_cache");
        verify(server, times(2)).addTool(any(SyncToolSpecification.class));
    }

    @Test
    void shouldCloseServerOnStop() {
        // Given
        registrar.start();

        // When
        registrar.stop();
        registrar.stop();

        // Then
        assertThat(registrar.isRunning()).isFalse();
        verify(server, times(1)).closeGracefully();
    }

    @Test
    void shouldNotCloseServerWhenNeverStarted() {
        // When
        registrar.stop();

        // Then
        verify(server, never()).closeGracefully();
    }
}

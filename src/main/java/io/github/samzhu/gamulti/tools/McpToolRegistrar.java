package io.github.samzhu.gamulti.tools;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import io.modelcontextprotocol.server.McpSyncServer;

/**
 * 在應用程式啟動完成後註冊所有工具，關閉時結束 MCP 連線。
 *
 * <p>實作 {@link SmartLifecycle} 確保：
 * <ul>
 *   <li>所有服務 bean 建立完成後才開放工具呼叫</li>
 *   <li>關閉時先結束 MCP session，再關閉執行緒池與 API 客戶端</li>
 * </ul>
 */
public class McpToolRegistrar implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(McpToolRegistrar.class);

    private final McpSyncServer server;
    private final List<ToolProvider> providers;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public McpToolRegistrar(McpSyncServer server, List<ToolProvider> providers) {
        this.server = server;
        this.providers = providers;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (ToolProvider provider : providers) {
            provider.registerTools();
        }
        log.info("MCP tools ready: {}", toolNames());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Closing MCP server...");
        server.closeGracefully();
        log.info("MCP server closed");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 最後啟動、最先關閉
        return Integer.MAX_VALUE - 100;
    }

    /**
     * 已註冊的工具名稱。
     */
    public List<String> toolNames() {
        return providers.stream().flatMap(p -> p.toolNames().stream()).toList();
    }
}

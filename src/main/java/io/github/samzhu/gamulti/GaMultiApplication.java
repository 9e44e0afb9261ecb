package io.github.samzhu.gamulti;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * GA Multi MCP - Google Analytics 4 多 Property 查詢服務。
 *
 * <p>此服務以 MCP (Model Context Protocol) 工具的形式提供給 LLM Agent 使用，負責：
 * <ul>
 *   <li>探索服務帳號可存取的 GA4 Property 並快取清單</li>
 *   <li>以模糊比對將自然語言名稱解析為 Property ID</li>
 *   <li>將單一查詢分派到多個 Property 並行執行，容忍部分失敗</li>
 *   <li>以 TTL 快取減少 GA4 API 呼叫次數</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Agent (stdio) → MCP Tool → QueryOrchestrator → FuzzyPropertyResolver → PropertyRegistry
 *                                   ↓                                          ↓
 *                              TtlCache ← Data API                        TtlCache ← Admin API
 * </pre>
 *
 * <p>stdout 保留給 MCP 協定，所有日誌輸出至 stderr（見 {@code logback-spring.xml}）。
 *
 * @see <a href="https://modelcontextprotocol.io/">Model Context Protocol</a>
 * @see <a href="https://developers.google.com/analytics/devguides/reporting/data/v1">GA4 Data API</a>
 */
@SpringBootApplication
@EnableScheduling
public class GaMultiApplication {

    private static final Logger log = LoggerFactory.getLogger(GaMultiApplication.class);

    public static void main(String[] args) {
        log.info("Starting GA Multi MCP - Google Analytics 4 multi-property server");
        SpringApplication.run(GaMultiApplication.class, args);
    }
}

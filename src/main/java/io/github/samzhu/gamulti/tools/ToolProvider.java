package io.github.samzhu.gamulti.tools;

import java.util.List;

/**
 * MCP 工具提供者。
 *
 * <p>每個提供者負責向 MCP 伺服器註冊一組相關的工具。
 */
public interface ToolProvider {

    /**
     * 向 MCP 伺服器註冊所有工具。
     */
    void registerTools();

    /**
     * 已註冊的工具名稱。
     */
    List<String> toolNames();
}

package io.github.samzhu.gamulti.client;

import java.util.List;

/**
 * GA4 Admin API 的最小介面。
 *
 * <p>只負責列出服務帳號可存取的帳號與 Property，不做快取。
 */
public interface AdminApiClient {

    /**
     * 列出所有可存取的帳號摘要。
     *
     * @return 帳號摘要，每個帳號帶有其 Property 清單
     * @throws ApiClientException 授權或網路錯誤
     */
    List<DiscoveredAccount> listAccountSummaries();
}

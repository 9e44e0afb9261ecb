package io.github.samzhu.gamulti.client.google;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.analytics.admin.v1beta.AccountSummary;
import com.google.analytics.admin.v1beta.AnalyticsAdminServiceClient;
import com.google.analytics.admin.v1beta.ListAccountSummariesRequest;
import com.google.analytics.admin.v1beta.PropertySummary;
import com.google.api.gax.rpc.ApiException;

import io.github.samzhu.gamulti.client.AdminApiClient;
import io.github.samzhu.gamulti.client.DiscoveredAccount;
import io.github.samzhu.gamulti.client.DiscoveredAccount.DiscoveredProperty;

/**
 * 以 GA4 Admin API v1beta 實作的 {@link AdminApiClient}。
 *
 * @see <a href="https://developers.google.com/analytics/devguides/config/admin/v1/rest/v1beta/accountSummaries/list">accountSummaries.list</a>
 */
public class GoogleAdminApiClient implements AdminApiClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleAdminApiClient.class);

    private static final int PAGE_SIZE = 200;

    private final AnalyticsAdminServiceClient client;

    public GoogleAdminApiClient(AnalyticsAdminServiceClient client) {
        this.client = client;
    }

    @Override
    public List<DiscoveredAccount> listAccountSummaries() {
        ListAccountSummariesRequest request = ListAccountSummariesRequest.newBuilder()
            .setPageSize(PAGE_SIZE)
            .build();
        try {
            List<DiscoveredAccount> accounts = new ArrayList<>();
            for (AccountSummary summary : client.listAccountSummaries(request).iterateAll()) {
                accounts.add(toAccount(summary));
            }
            log.debug("Admin API returned {} account summaries", accounts.size());
            return accounts;
        } catch (ApiException e) {
            throw GoogleApiErrors.translate("listAccountSummaries", e);
        }
    }

    static DiscoveredAccount toAccount(AccountSummary summary) {
        List<DiscoveredProperty> properties = new ArrayList<>();
        for (PropertySummary p : summary.getPropertySummariesList()) {
            properties.add(new DiscoveredProperty(lastSegment(p.getProperty()), p.getProperty(), p.getDisplayName()));
        }
        return new DiscoveredAccount(lastSegment(summary.getAccount()), summary.getDisplayName(), properties);
    }

    static String lastSegment(String resourceName) {
        int slash = resourceName.lastIndexOf('/');
        return slash >= 0 ? resourceName.substring(slash + 1) : resourceName;
    }
}

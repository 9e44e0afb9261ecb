package io.github.samzhu.gamulti.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import io.github.samzhu.gamulti.client.AdminApiClient;
import io.github.samzhu.gamulti.client.ApiClientException;
import io.github.samzhu.gamulti.client.DiscoveredAccount;
import io.github.samzhu.gamulti.client.DiscoveredAccount.DiscoveredProperty;

/**
 * 回傳固定帳號清單的 Admin API 替身。
 */
public class FakeAdminApiClient implements AdminApiClient {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile List<DiscoveredAccount> accounts = List.of();
    private volatile ApiClientException failure;
    private volatile Duration delay = Duration.ZERO;

    /**
     * 預設資料：Acme 帳號下 4 個 Property、Globex 帳號下 2 個。
     */
    public static FakeAdminApiClient withDefaultProperties() {
        FakeAdminApiClient client = new FakeAdminApiClient();
        client.setAccounts(List.of(
            account("100", "Acme",
                property("111", "My Blog"),
                property("222", "Company Website"),
                property("333", "Online Store"),
                property("444", "Mobile App")),
            account("200", "Globex",
                property("555", "Store EU"),
                property("666", "Store US"))));
        return client;
    }

    public static DiscoveredAccount account(String id, String name, DiscoveredProperty... properties) {
        return new DiscoveredAccount(id, name, List.of(properties));
    }

    public static DiscoveredProperty property(String id, String name) {
        return new DiscoveredProperty(id, "properties/" + id, name);
    }

    public void setAccounts(List<DiscoveredAccount> accounts) {
        this.accounts = new ArrayList<>(accounts);
    }

    public void failWith(ApiClientException failure) {
        this.failure = failure;
    }

    public void delayBy(Duration delay) {
        this.delay = delay;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public List<DiscoveredAccount> listAccountSummaries() {
        calls.incrementAndGet();
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failure != null) {
            throw failure;
        }
        return accounts;
    }
}

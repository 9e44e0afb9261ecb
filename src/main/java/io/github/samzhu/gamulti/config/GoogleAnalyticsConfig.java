package io.github.samzhu.gamulti.config;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.analytics.admin.v1beta.AnalyticsAdminServiceClient;
import com.google.analytics.admin.v1beta.AnalyticsAdminServiceSettings;
import com.google.analytics.data.v1beta.BetaAnalyticsDataClient;
import com.google.analytics.data.v1beta.BetaAnalyticsDataSettings;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;

import io.github.samzhu.gamulti.client.AdminApiClient;
import io.github.samzhu.gamulti.client.DataApiClient;
import io.github.samzhu.gamulti.client.google.GoogleAdminApiClient;
import io.github.samzhu.gamulti.client.google.GoogleDataApiClient;
import io.github.samzhu.gamulti.exception.ConfigurationException;

/**
 * Google Analytics 4 API 客戶端配置。
 *
 * <p>從 {@code ga.credentials-path} 讀取服務帳號金鑰，以唯讀 scope 建立 Admin 與 Data API 客戶端。
 * 缺少路徑或檔案無法讀取時啟動失敗。
 *
 * <p>設定 {@code ga.google.enabled=false} 可停用此配置（例如測試中改用替身實作）。
 *
 * @see <a href="https://cloud.google.com/java/docs/reference/google-analytics-data/latest/overview">google-analytics-data</a>
 */
@Configuration
@ConditionalOnProperty(prefix = "ga.google", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GoogleAnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(GoogleAnalyticsConfig.class);

    static final String ANALYTICS_READONLY_SCOPE = "https://www.googleapis.com/auth/analytics.readonly";

    @Bean
    public GoogleCredentials googleCredentials(GaMultiProperties properties) {
        String path = properties.credentialsPath();
        if (path == null || path.isBlank()) {
            throw new ConfigurationException(
                "Google credentials path is required: set GOOGLE_APPLICATION_CREDENTIALS or GA_CREDENTIALS_PATH");
        }
        Path file = Path.of(path);
        try (InputStream in = Files.newInputStream(file)) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(in).createScoped(ANALYTICS_READONLY_SCOPE);
            log.info("Loaded Google credentials from {}", file.toAbsolutePath());
            return credentials;
        } catch (FileNotFoundException | NoSuchFileException e) {
            throw new ConfigurationException("Google credentials file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read Google credentials from " + path + ": " + e.getMessage(), e);
        }
    }

    @Bean(destroyMethod = "close")
    public AnalyticsAdminServiceClient analyticsAdminServiceClient(GoogleCredentials credentials) throws IOException {
        AnalyticsAdminServiceSettings settings = AnalyticsAdminServiceSettings.newBuilder()
            .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
            .build();
        return AnalyticsAdminServiceClient.create(settings);
    }

    @Bean(destroyMethod = "close")
    public BetaAnalyticsDataClient betaAnalyticsDataClient(GoogleCredentials credentials) throws IOException {
        BetaAnalyticsDataSettings settings = BetaAnalyticsDataSettings.newBuilder()
            .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
            .build();
        return BetaAnalyticsDataClient.create(settings);
    }

    @Bean
    public AdminApiClient adminApiClient(AnalyticsAdminServiceClient client) {
        return new GoogleAdminApiClient(client);
    }

    @Bean
    public DataApiClient dataApiClient(BetaAnalyticsDataClient client) {
        return new GoogleDataApiClient(client);
    }
}

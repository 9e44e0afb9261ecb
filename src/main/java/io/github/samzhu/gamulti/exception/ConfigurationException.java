package io.github.samzhu.gamulti.exception;

/**
 * 組態錯誤例外。
 *
 * <p>於啟動階段拋出，例如缺少 Google 憑證路徑、門檻值超出範圍、別名 JSON 格式錯誤。
 * 此錯誤會讓應用程式啟動失敗。
 */
public class ConfigurationException extends AnalyticsException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_ERROR, message,
            "Fix the ga.* settings (or the matching GA_* environment variables) and restart the server");
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION_ERROR, message,
            "Fix the ga.* settings (or the matching GA_* environment variables) and restart the server", cause);
    }
}

package com.example.magiogateway.common.config;

import java.net.URI;
import java.util.Locale;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@Data
@ConfigurationProperties(prefix = "app.magio")
public class AppMagioProperties {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36 MagioGO/4.0.21";

    private String username = "";

    private String password = "";

    private String language = "cz";

    private String baseUrl;

    private String deviceId;

    private String deviceName = "Android TV";

    private String deviceType = "OTT_STB";

    private String appVersion = "4.0.25-hf.0";

    private String userAgent = DEFAULT_USER_AGENT;

    private String quality = "p5";

    private String dataDir = "data";

    private boolean persistTokens = true;

    private long refreshMarginSeconds = 60;

    public String normalizedLanguage() {
        return StringUtils.hasText(language) ? language.trim().toLowerCase(Locale.ROOT) : "cz";
    }

    public String resolveBaseUrl() {
        if (StringUtils.hasText(baseUrl)) {
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }
        String lang = normalizedLanguage();
        if ("cz".equals(lang)) {
            return "https://czgo.magio.tv";
        }
        if ("sk".equals(lang)) {
            return "https://skgo.magio.tv";
        }
        return "https://" + lang + "go.magio.tv";
    }

    public String resolveHost() {
        return URI.create(resolveBaseUrl()).getRawAuthority();
    }

    public String resolveReferer() {
        return "https://" + normalizedLanguage() + "go.magio.tv/";
    }
}

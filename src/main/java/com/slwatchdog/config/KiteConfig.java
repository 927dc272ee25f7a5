package com.slwatchdog.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and the shared {@link KiteConnect} client.
 *
 * <p>Binds to the {@code kite.*} prefix. The access token is produced by the daily
 * login flow outside this service and supplied through configuration or the
 * {@code KITE_ACCESS_TOKEN} environment variable.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    /** Session access token for the current trading day. */
    private String accessToken;

    /** Zerodha client id the token belongs to. */
    private String userId;

    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect client with API key: {}", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        if (userId != null && !userId.isBlank()) {
            kiteConnect.setUserId(userId);
        }
        if (accessToken != null && !accessToken.isBlank()) {
            kiteConnect.setAccessToken(accessToken);
        } else {
            log.warn("No Kite access token configured; broker calls will fail authentication");
        }
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (reported by SDK)"));
        return kiteConnect;
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}

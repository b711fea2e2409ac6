package com.ethval.ingestion.config;

import com.ethval.catalog.SourceApi;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * API keys and base URL overrides for external sources (ethval.sources).
 */
@ConfigurationProperties(prefix = "ethval.sources")
@Getter
@Setter
public class SourceProperties {

    /**
     * Optional; raises CryptoCompare's free rate limit.
     */
    private String cryptocompareApiKey = "";

    /**
     * Required by Etherscan's stats API. Without it Etherscan API tiers are skipped.
     */
    private String etherscanApiKey = "";

    /**
     * Per-API base URL override, e.g. {@code base-urls.DEFILLAMA=http://localhost:8089}.
     */
    private Map<SourceApi, String> baseUrls = new EnumMap<>(SourceApi.class);

    public String baseUrl(SourceApi api) {
        String override = baseUrls.get(api);
        return override == null || override.isBlank() ? api.getDefaultBaseUrl() : override;
    }

    /** Key for the API, or empty when none is configured or the API takes none. */
    public String apiKey(SourceApi api) {
        String key = switch (api) {
            case ETHERSCAN -> etherscanApiKey;
            case CRYPTOCOMPARE -> cryptocompareApiKey;
            default -> "";
        };
        return key == null ? "" : key.trim();
    }
}

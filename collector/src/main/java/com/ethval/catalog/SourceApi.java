package com.ethval.catalog;

/**
 * Classes of external API. Each class has its own rate limiter, a base URL usable in URL templates as
 * {@code {<lowercase name>}} (e.g. {@code {defillama}}), and optionally an API key.
 */
public enum SourceApi {
    CRYPTOCOMPARE("https://min-api.cryptocompare.com", false),
    COINGECKO("https://api.coingecko.com/api/v3", false),
    DEFILLAMA("https://api.llama.fi", false),
    DEFILLAMA_STABLECOINS("https://stablecoins.llama.fi", false),
    DEFILLAMA_YIELDS("https://yields.llama.fi", false),
    ETHERSCAN("https://api.etherscan.io/api", true),
    ETHERSCAN_WEB("https://etherscan.io", false),
    ALTERNATIVE_ME("https://api.alternative.me", false),
    BEACONCHAIN("https://beaconcha.in", false),
    LIDO("https://eth-api.lido.fi", false),
    ULTRASOUND("https://ultrasound.money", false);

    private final String defaultBaseUrl;
    private final boolean apiKeyRequired;

    SourceApi(String defaultBaseUrl, boolean apiKeyRequired) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyRequired = apiKeyRequired;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    /** Tiers of this API fail fast with SourceUnavailable when no key is configured. */
    public boolean isApiKeyRequired() {
        return apiKeyRequired;
    }

    public String placeholder() {
        return name().toLowerCase();
    }
}

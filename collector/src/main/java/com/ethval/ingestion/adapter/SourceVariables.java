package com.ethval.ingestion.adapter;

import com.ethval.catalog.SourceApi;
import com.ethval.domain.DateWindow;
import com.ethval.ingestion.config.SourceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the placeholder values of source URL templates: API base URLs, API keys, the dimension and
 * the requested date range.
 */
@Component
@RequiredArgsConstructor
public class SourceVariables {

    private final SourceProperties sourceProperties;

    public Map<String, String> forWindow(FetchContext context, DateWindow range) {
        Map<String, String> vars = new HashMap<>();
        for (SourceApi api : SourceApi.values()) {
            vars.put(api.placeholder(), stripTrailingSlash(sourceProperties.baseUrl(api)));
        }
        vars.put("cryptocompareKey", encode(sourceProperties.apiKey(SourceApi.CRYPTOCOMPARE)));
        vars.put("etherscanKey", encode(sourceProperties.apiKey(SourceApi.ETHERSCAN)));
        if (context.dimension() != null) {
            vars.put("dimension", UriUtils.encodePathSegment(context.dimension(), StandardCharsets.UTF_8));
        }
        vars.put("startDate", range.from().toString());
        vars.put("endDate", range.to().toString());
        vars.put("days", String.valueOf(context.window().days()));
        return vars;
    }

    /**
     * @throws SourceUnavailableException when the API needs a key and none is configured
     */
    public void requireKey(SourceApi api) {
        if (api.isApiKeyRequired() && sourceProperties.apiKey(api).isEmpty()) {
            throw new SourceUnavailableException(api + " API key not configured");
        }
    }

    private static String encode(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package com.ethval.catalog;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Live JSON API tier. With several requests the first one drives the rows and the others are joined
 * onto it by calendar date (e.g. Etherscan gas price + transaction count + gas limit).
 */
public record RestJsonTier(String sourceTag, SourceApi api, List<JsonRequest> requests, Pagination pagination)
        implements TierSpec {

    public RestJsonTier {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("REST-JSON tier needs at least one request");
        }
        requests = List.copyOf(requests);
        pagination = pagination == null ? Pagination.none() : pagination;
    }

    public static RestJsonTier of(String sourceTag, SourceApi api, JsonRequest... requests) {
        return new RestJsonTier(sourceTag, api, List.of(requests), Pagination.none());
    }

    public static RestJsonTier paged(String sourceTag, SourceApi api, Pagination pagination, JsonRequest... requests) {
        return new RestJsonTier(sourceTag, api, List.of(requests), pagination);
    }

    @Override
    public Set<String> producedFields() {
        Set<String> fields = new LinkedHashSet<>();
        requests.forEach(r -> fields.addAll(r.fieldPointers().keySet()));
        return fields;
    }
}

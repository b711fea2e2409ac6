package com.ethval.catalog;

import java.util.List;

/**
 * A themed slice of the catalog. Groups are collected by {@link MetricCatalog} in {@code @Order} order.
 */
public interface MetricGroup {

    List<MetricDefinition> definitions();
}

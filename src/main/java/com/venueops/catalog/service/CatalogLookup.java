package com.venueops.catalog.service;

import java.util.Optional;

/**
 * Resolves a line item's menu category. An empty result means "unknown", which routes
 * the item to the default station.
 */
public interface CatalogLookup {

    Optional<String> categoryOf(String venueId, Long menuItemId);
}

package com.venueops.catalog.service;

import com.venueops.catalog.repository.MenuItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MenuCatalogService implements CatalogLookup {

    private final MenuItemRepository menuItemRepository;

    /**
     * Categories change rarely and are looked up once per routed line item,
     * so results are cached per (venue, item).
     */
    @Override
    @Cacheable(value = "menuCategories", key = "#venueId + ':' + #menuItemId", unless = "#result == null")
    public Optional<String> categoryOf(String venueId, Long menuItemId) {
        if (menuItemId == null) {
            return Optional.empty();
        }
        Optional<String> category = menuItemRepository.findCategory(venueId, menuItemId)
                .filter(value -> !value.isBlank());
        if (category.isEmpty()) {
            log.debug("No category for menu item: venueId={}, menuItemId={}", venueId, menuItemId);
        }
        return category;
    }
}

package com.creativeforge.orchestrator.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Primary product categories the analysis stage may assign.
 */
public enum ProductCategory {
    APPAREL,
    FOOTWEAR,
    JEWELLERY,
    BEAUTY,
    FOOD_AND_BEVERAGE,
    ELECTRONICS,
    HOME_DECOR,
    HANDICRAFT,
    TOYS,
    OTHER;

    /** Lenient lookup for labels returned by the analysis service ("home decor", "Home-Decor"). */
    public static Optional<ProductCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Arrays.stream(values()).filter(c -> c.name().equals(normalized)).findFirst();
    }
}

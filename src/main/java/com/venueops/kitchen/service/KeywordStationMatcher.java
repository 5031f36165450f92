package com.venueops.kitchen.service;

import com.venueops.kitchen.entity.Station;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Item-name keyword routing, used when no catalog category matched a station.
 * Tiers are checked in order; a matching tier only wins if the venue has a station of
 * one of its types, otherwise the next tier is tried.
 *
 * <p>Keywords match at the start of a word, so "tea" does not claim "steak".
 */
public class KeywordStationMatcher {

    private static final List<String> BARISTA = List.of(
            "coffee", "latte", "cappuccino", "espresso", "mocha", "americano", "macchiato",
            "flat white", "cortado", "doppio", "lungo", "ristretto", "tea", "matcha", "chai",
            "hot chocolate", "cocoa", "smoothie", "juice", "shake", "frappe", "frappuccino",
            "milkshake", "drink", "beverage", "yogurt", "acai", "parfait", "boba", "cold brew", "refresher",
            "lemonade", "iced", "soda");

    private static final List<String> FRYER = List.of(
            "fries", "chips", "fried", "fryer", "wings", "nuggets", "crispy", "tempura", "calamari",
            "onion rings", "mozzarella sticks", "spring rolls", "samosa", "pakora", "fritter",
            "doughnut", "donut", "beignet", "churro", "funnel cake", "corn dog");

    private static final List<String> PIZZA_PASTA = List.of(
            "pizza", "pasta", "spaghetti", "penne", "fettuccine", "linguine", "ravioli", "lasagna",
            "gnocchi", "risotto", "carbonara", "alfredo", "marinara", "bolognese", "pesto",
            "calzone", "stromboli", "flatbread");

    private static final List<String> GRILL = List.of(
            "burger", "steak", "chicken", "beef", "lamb", "pork", "sausage", "kebab", "grill", "bbq",
            "barbecue", "ribs", "halloumi", "patty", "meat", "bacon", "pancake", "waffle", "toast",
            "croissant", "bagel", "omelet", "eggs", "breakfast", "brunch", "hash", "skewer", "kabob",
            "shish", "tandoori", "tikka", "curry", "masala", "teriyaki", "stir fry", "stir-fry", "wok",
            "fajita", "quesadilla", "taco", "burrito", "enchilada", "queso", "nachos", "loaded");

    private static final List<String> SOUP = List.of("soup", "stew", "chowder", "bisque", "broth");

    private static final List<String> COLD_MARKERS = List.of(
            "salad", "sandwich", "wrap", "sushi", "poke", "cold");

    private static final List<String> COLD = List.of(
            "salad", "sandwich", "wrap", "cold", "sushi", "poke", "hummus", "mezze", "dip", "labneh",
            "tzatziki", "avo", "ceviche", "tartare", "carpaccio", "bruschetta", "antipasto",
            "charcuterie", "cheese board", "platter", "gazpacho");

    private static final List<String> DRINK_BOWL = List.of("matcha", "yogurt", "acai", "parfait");

    private static final List<String> DESSERT = List.of(
            "dessert", "cake", "pie", "tart", "mousse", "pudding", "custard", "ice cream", "gelato",
            "sorbet", "cheesecake", "brownie", "cookie", "biscuit", "muffin", "scone", "pastry",
            "eclair", "tiramisu", "creme brulee", "flan", "panna cotta");

    private record Tier(Predicate<String> matches, List<String> stationTypes) {
    }

    private static final List<Tier> TIERS = List.of(
            new Tier(name -> containsAny(name, BARISTA), List.of("barista")),
            new Tier(name -> containsAny(name, FRYER), List.of("fryer")),
            new Tier(name -> containsAny(name, PIZZA_PASTA), List.of("pizza", "pasta")),
            new Tier(name -> containsAny(name, GRILL) && !containsAny(name, COLD_MARKERS)
                    && !containsAny(name, SOUP), List.of("grill")),
            new Tier(name -> containsAny(name, SOUP), List.of("soup", "grill")),
            new Tier(name -> containsAny(name, COLD)
                    || (containsWord(name, "bowl") && !containsAny(name, DRINK_BOWL)), List.of("cold")),
            new Tier(name -> containsAny(name, DESSERT), List.of("dessert", "cold"))
    );

    public Optional<Station> match(String itemName, List<Station> stations) {
        if (itemName == null || itemName.isBlank()) {
            return Optional.empty();
        }
        String name = itemName.toLowerCase(Locale.ROOT);
        for (Tier tier : TIERS) {
            if (!tier.matches().test(name)) {
                continue;
            }
            for (String type : tier.stationTypes()) {
                Optional<Station> station = stations.stream()
                        .filter(candidate -> type.equalsIgnoreCase(candidate.getStationType()))
                        .findFirst();
                if (station.isPresent()) {
                    return station;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean containsAny(String name, List<String> keywords) {
        return keywords.stream().anyMatch(keyword -> containsWord(name, keyword));
    }

    static boolean containsWord(String name, String keyword) {
        int from = 0;
        while (true) {
            int index = name.indexOf(keyword, from);
            if (index < 0) {
                return false;
            }
            if (index == 0 || !Character.isLetter(name.charAt(index - 1))) {
                return true;
            }
            from = index + 1;
        }
    }
}

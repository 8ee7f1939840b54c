package com.mike.reportpopulator.service.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Known company names, case preserved. Blank names are dropped and duplicates keep
 * their first position.
 */
public record CompanyCatalog(List<String> names) {

    public CompanyCatalog {
        Set<String> distinct = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.isBlank()) distinct.add(name);
            }
        }
        names = List.copyOf(distinct);
    }

    public static CompanyCatalog of(String... names) {
        return new CompanyCatalog(List.of(names));
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * Longest names first; equal lengths stay in catalog order.
     */
    public List<String> longestFirst() {
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }
}

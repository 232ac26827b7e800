package com.arenasync.template;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class TemplateQueries {
    private TemplateQueries() {
    }

    public static Optional<Template> byName(List<Template> templates, String name) {
        return templates.stream()
                .filter(template -> template.name().equals(name))
                .findFirst();
    }

    public static List<Template> filterByCategory(List<Template> templates, String category) {
        if (category == null || category.isBlank()) {
            return templates;
        }
        return templates.stream()
                .filter(template -> template.category().equalsIgnoreCase(category.strip()))
                .toList();
    }

    public static List<Template> filterByTags(List<Template> templates, List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return templates;
        }
        return templates.stream()
                .filter(template -> template.tags().stream()
                        .anyMatch(tag -> tags.stream().anyMatch(wanted -> wanted.equalsIgnoreCase(tag))))
                .toList();
    }

    public static List<Template> search(List<Template> templates, String query) {
        if (query == null || query.isBlank()) {
            return templates;
        }
        String needle = query.strip().toLowerCase(Locale.ROOT);
        return templates.stream()
                .filter(template -> contains(template.name(), needle)
                        || contains(template.displayName(), needle)
                        || contains(template.description(), needle))
                .toList();
    }

    private static boolean contains(String value, String needle) {
        return value.toLowerCase(Locale.ROOT).contains(needle);
    }
}

package com.arenasync.template;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateQueriesTest {

    private final List<Template> templates = List.of(
            template("postgres", "PostgreSQL", "Relational database", "data", List.of("sql", "stateful")),
            template("nginx", "NGINX", "Reverse proxy", "networking", List.of("http")),
            template("redis", "Redis", "In-memory cache", "Data", List.of("cache", "stateful")));

    @Test
    void shouldFindByExactName() {
        assertEquals("nginx", TemplateQueries.byName(templates, "nginx").orElseThrow().name());
        assertTrue(TemplateQueries.byName(templates, "NGINX").isEmpty());
    }

    @Test
    void shouldFilterByCategoryIgnoringCase() {
        assertEquals(List.of("postgres", "redis"), names(TemplateQueries.filterByCategory(templates, "DATA")));
        assertEquals(3, TemplateQueries.filterByCategory(templates, "").size());
    }

    @Test
    void shouldMatchAnyRequestedTag() {
        assertEquals(List.of("postgres", "redis"), names(TemplateQueries.filterByTags(templates, List.of("Stateful"))));
        assertEquals(List.of("nginx", "redis"), names(TemplateQueries.filterByTags(templates, List.of("http", "cache"))));
        assertEquals(3, TemplateQueries.filterByTags(templates, List.of()).size());
    }

    @Test
    void shouldSearchNameDisplayNameAndDescription() {
        assertEquals(List.of("redis"), names(TemplateQueries.search(templates, "memory")));
        assertEquals(List.of("postgres"), names(TemplateQueries.search(templates, "postgresql")));
        assertEquals(3, TemplateQueries.search(templates, " ").size());
    }

    private static Template template(String name, String displayName, String description, String category, List<String> tags) {
        return new Template(name, "1.0.0", displayName, description, category, tags, null, null, "templates/" + name);
    }

    private static List<String> names(List<Template> matches) {
        return matches.stream().map(Template::name).toList();
    }
}

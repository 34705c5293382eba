package org.arena.service.impl;

import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.ModelCategory;
import org.arena.domain.exception.ModelNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogImplTest {

    private ModelCatalogImpl catalog;

    @BeforeEach
    void setUp() {
        catalog = new ModelCatalogImpl(new ArenaProperties());
        catalog.register("p1", List.of(
                new ArenaModel("GPT-4o", "id-gpt4o", ModelCategory.TEXT),
                new ArenaModel("claude-3-5-sonnet", "id-claude", ModelCategory.VISION),
                new ArenaModel("dall-e-3", "id-dalle", ModelCategory.IMAGE)));
    }

    @Test
    void exactMatchWins() {
        assertEquals("id-gpt4o", catalog.resolve("GPT-4o").getId());
    }

    @Test
    void fuzzyMatchIgnoresCaseAndPunctuation() {
        assertEquals("GPT-4o", catalog.resolve("gpt 4o").getName());
        assertEquals("claude-3-5-sonnet", catalog.resolve("Claude 3.5 Sonnet").getName());
    }

    @Test
    void containmentMatches() {
        assertEquals("dall-e-3", catalog.resolve("dalle").getName());
    }

    @Test
    void notFoundCarriesCatalogNames() {
        ModelNotFoundException e = assertThrows(ModelNotFoundException.class, () -> catalog.resolve("llama-70b-instruct"));
        assertEquals("llama-70b-instruct", e.getRequestedModel());
        assertEquals(List.of("GPT-4o", "claude-3-5-sonnet", "dall-e-3"), e.getAvailableModels());
    }

    @Test
    void emptyCatalogRejectsEverything() {
        ModelCatalogImpl empty = new ModelCatalogImpl(new ArenaProperties());
        ModelNotFoundException e = assertThrows(ModelNotFoundException.class, () -> empty.resolve("gpt-4o"));
        assertTrue(e.getAvailableModels().isEmpty());
    }

    @Test
    void tieKeepsLexicographicallyFirst() {
        ModelCatalogImpl tied = new ModelCatalogImpl(new ArenaProperties());
        tied.register("p1", List.of(
                new ArenaModel("model-b", "b", ModelCategory.TEXT),
                new ArenaModel("model-a", "a", ModelCategory.TEXT)));

        assertEquals("model-a", tied.resolve("model-c").getName());
    }

    @Test
    void lastWriterWinsAndUnregisterRebuilds() {
        catalog.register("p2", List.of(new ArenaModel("GPT-4o", "id-gpt4o-v2", ModelCategory.VISION)));
        assertEquals(ModelCategory.VISION, catalog.resolve("GPT-4o").getCategory());

        catalog.unregister("p2");
        assertEquals(ModelCategory.TEXT, catalog.resolve("GPT-4o").getCategory());

        catalog.unregister("p1");
        assertTrue(catalog.listModels().isEmpty());
    }

    @Test
    void registerReplacesPreviousContributionOfSameProfile() {
        catalog.register("p1", List.of(new ArenaModel("gemini-pro", "id-gemini", ModelCategory.TEXT)));
        assertEquals(1, catalog.listModels().size());
    }

    @Test
    void similarityBounds() {
        assertEquals(1.0, ModelCatalogImpl.similarity("abc", "abc"));
        assertEquals(0.0, ModelCatalogImpl.similarity("", "abc"));
        assertTrue(ModelCatalogImpl.similarity("gpt4", "gpt4o") >= 0.7);
        assertEquals(3, ModelCatalogImpl.levenshtein("kitten", "sitting"));
        assertEquals("gpt4o", ModelCatalogImpl.normalize("GPT-4o"));
    }
}

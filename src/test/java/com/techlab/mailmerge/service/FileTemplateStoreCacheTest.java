package com.techlab.mailmerge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.config.CacheConfig;
import com.techlab.mailmerge.exception.ResourceNotFoundException;
import com.techlab.mailmerge.model.StoredTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringJUnitConfig
public class FileTemplateStoreCacheTest {

    private static final Path TEMPLATE_DIR = createTemplateDir();

    @Configuration
    @Import({CacheConfig.class, FileTemplateStore.class})
    static class Config {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }
    }

    @DynamicPropertySource
    static void templateDirectory(DynamicPropertyRegistry registry) {
        registry.add("mailmerge.templates.dir", TEMPLATE_DIR::toString);
    }

    @Autowired
    private TemplateStore store;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    public void setUp() {
        cacheManager.getCache(CacheConfig.TEMPLATES_CACHE).clear();
    }

    private static StoredTemplate template(String name, String content) {
        return StoredTemplate.builder().name(name).templateContent(content).build();
    }

    @Test
    public void testLoadIsCachedUnderSafeName() throws IOException {
        store.save(template("Note de service", "<p>v1</p>"));

        StoredTemplate first = store.load("Note de service");
        Files.delete(TEMPLATE_DIR.resolve("Note_de_service.json"));

        assertThat(store.load("Note de service")).isSameAs(first);
        assertThat(store.load("Note_de_service")).isSameAs(first);
        assertThat(cacheManager.getCache(CacheConfig.TEMPLATES_CACHE).get("Note_de_service").get()).isSameAs(first);
    }

    @Test
    public void testSaveEvictsCachedTemplate() {
        store.save(template("Relance", "<p>v1</p>"));
        assertThat(store.load("Relance").getTemplateContent()).isEqualTo("<p>v1</p>");

        store.save(template("Relance", "<p>v2</p>"));

        assertThat(store.load("Relance").getTemplateContent()).isEqualTo("<p>v2</p>");
    }

    @Test
    public void testDeleteEvictsCachedTemplate() {
        store.save(template("Rappel", "<p>v1</p>"));
        store.load("Rappel");

        store.delete("Rappel");

        assertThatThrownBy(() -> store.load("Rappel")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    public void testCachedTemplateIsNotChangedByDerivedCopies() {
        store.save(template("Convocation", "<p>original</p>"));
        StoredTemplate cached = store.load("Convocation");

        StoredTemplate edited = cached.toBuilder().templateContent("<p>edited</p>").build();

        assertThat(edited.getTemplateContent()).isEqualTo("<p>edited</p>");
        assertThat(store.load("Convocation").getTemplateContent()).isEqualTo("<p>original</p>");
    }

    private static Path createTemplateDir() {
        try {
            return Files.createTempDirectory("mail-merge-cache-test");
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}

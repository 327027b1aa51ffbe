package com.techlab.mailmerge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.config.CacheConfig;
import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.exception.ResourceNotFoundException;
import com.techlab.mailmerge.exception.TemplateStorageException;
import com.techlab.mailmerge.model.StoredTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Template store keeping one JSON file per template in the templates directory.
 */
@Slf4j
@Service
public class FileTemplateStore implements TemplateStore {

    private static final String EXTENSION = ".json";

    private final Path templateDirectory;
    private final ObjectMapper objectMapper;

    public FileTemplateStore(@Value("${mailmerge.templates.dir:./templates_publipostage}") String templateDir,
                             ObjectMapper objectMapper) {
        this.templateDirectory = Paths.get(templateDir);
        this.objectMapper = objectMapper;
    }

    /**
     * File-safe form of a template name: letters, digits, space, '-' and '_' are kept, trailing
     * spaces dropped, spaces turned into '_'.
     */
    public static String safeName(String templateName) {
        if (templateName == null) {
            return "";
        }
        StringBuilder kept = new StringBuilder(templateName.length());
        templateName.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
                .forEach(kept::appendCodePoint);
        return kept.toString().stripTrailing().replace(' ', '_');
    }

    @Override
    @CacheEvict(cacheNames = CacheConfig.TEMPLATES_CACHE, key = "T(com.techlab.mailmerge.service.FileTemplateStore).safeName(#template.name)")
    public String save(StoredTemplate template) {
        String name = safeName(template.getName());
        if (name.isEmpty()) {
            throw new InvalidInputException("Template name is required");
        }
        if (template.getTemplateContent() == null || template.getTemplateContent().isBlank()) {
            throw new InvalidInputException("Template content is required");
        }

        try {
            if (!Files.exists(templateDirectory)) {
                Files.createDirectories(templateDirectory);
                log.info("Created template directory: {}", templateDirectory);
            }

            Path targetPath = templatePath(name);
            Instant now = Instant.now();
            Instant createdAt = now;
            if (Files.exists(targetPath)) {
                StoredTemplate previous = objectMapper.readValue(targetPath.toFile(), StoredTemplate.class);
                if (previous.getCreatedAt() != null) {
                    createdAt = previous.getCreatedAt();
                }
            }

            StoredTemplate stored = template.toBuilder()
                    .name(template.getName().strip())
                    .createdAt(createdAt)
                    .updatedAt(now)
                    .build();

            // replace atomically through a temp file of our own
            Path tempPath = Files.createTempFile(templateDirectory, name + "-", ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempPath.toFile(), stored);
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tempPath);
            }

            log.info("Template saved: {} -> {}", template.getName(), targetPath);
            return name;
        } catch (IOException e) {
            throw new TemplateStorageException("Error saving template: " + template.getName(), e);
        }
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TEMPLATES_CACHE, key = "T(com.techlab.mailmerge.service.FileTemplateStore).safeName(#name)")
    public StoredTemplate load(String name) {
        Path path = templatePath(safeName(name));
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException("Template not found: " + name);
        }
        log.debug("Loading template from disk: {}", path);
        try {
            return objectMapper.readValue(path.toFile(), StoredTemplate.class);
        } catch (IOException e) {
            throw new TemplateStorageException("Error reading template: " + name, e);
        }
    }

    @Override
    public List<String> list() {
        if (!Files.exists(templateDirectory)) {
            return List.of();
        }

        List<StoredTemplate> templates = new ArrayList<>();
        try (Stream<Path> files = Files.list(templateDirectory)) {
            files.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .forEach(path -> {
                        try {
                            templates.add(objectMapper.readValue(path.toFile(), StoredTemplate.class));
                        } catch (IOException e) {
                            log.warn("Skipping unreadable template file {}: {}", path.getFileName(), e.getMessage());
                        }
                    });
        } catch (IOException e) {
            throw new TemplateStorageException("Error listing templates", e);
        }

        return templates.stream()
                .filter(template -> template.getName() != null)
                .sorted(Comparator.comparing(StoredTemplate::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(StoredTemplate::getName)
                .toList();
    }

    @Override
    @CacheEvict(cacheNames = CacheConfig.TEMPLATES_CACHE, key = "T(com.techlab.mailmerge.service.FileTemplateStore).safeName(#name)")
    public void delete(String name) {
        Path path = templatePath(safeName(name));
        try {
            if (!Files.deleteIfExists(path)) {
                throw new ResourceNotFoundException("Template not found: " + name);
            }
            log.info("Template deleted: {}", name);
        } catch (IOException e) {
            throw new TemplateStorageException("Error deleting template: " + name, e);
        }
    }

    private Path templatePath(String safeName) {
        if (safeName.isEmpty()) {
            throw new InvalidInputException("Template name is required");
        }
        return templateDirectory.resolve(safeName + EXTENSION);
    }
}

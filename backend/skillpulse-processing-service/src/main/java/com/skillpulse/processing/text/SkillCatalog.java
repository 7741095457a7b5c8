package com.skillpulse.processing.text;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Declarative skill vocabulary, read once at startup from a JSON document of the form
 * {@code {"skills":[{"name":"PostgreSQL","category":"Database","aliases":["postgres","pg"]}]}}.
 */
public final class SkillCatalog {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private static final Logger log = LoggerFactory.getLogger(SkillCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<SkillDefinition> skills;

    private SkillCatalog(List<SkillDefinition> skills) {
        this.skills = List.copyOf(skills);
    }

    public static SkillCatalog of(List<SkillDefinition> skills) {
        if (skills == null || skills.isEmpty()) {
            throw new SkillCatalogException("Skill catalog contains no skills");
        }
        return new SkillCatalog(skills);
    }

    /**
     * Loads the catalog from {@code classpath:some/resource.json} or a filesystem path.
     */
    public static SkillCatalog load(String location) {
        if (location == null || location.isBlank()) {
            throw new SkillCatalogException("Skill catalog location is not configured");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (!resource.startsWith("/")) resource = "/" + resource;
            try (InputStream in = SkillCatalog.class.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new SkillCatalogException("Skill catalog not found at " + location);
                }
                return load(in, location);
            } catch (IOException e) {
                throw new SkillCatalogException("Failed to read skill catalog at " + location, e);
            }
        }
        return load(Path.of(location));
    }

    public static SkillCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new SkillCatalogException("Skill catalog not found at " + path, e);
        } catch (IOException e) {
            throw new SkillCatalogException("Failed to read skill catalog at " + path, e);
        }
    }

    public static SkillCatalog load(InputStream in, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new SkillCatalogException("Invalid JSON in skill catalog " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SkillCatalogException("Failed to read skill catalog " + source, e);
        }

        JsonNode entries = root == null ? null : root.get("skills");
        if (entries == null || !entries.isArray()) {
            throw new SkillCatalogException("Skill catalog " + source + " has no 'skills' array");
        }

        List<SkillDefinition> out = new ArrayList<>(entries.size());
        int index = 0;
        for (JsonNode entry : entries) {
            JsonNode name = entry.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                throw new SkillCatalogException("Skill catalog " + source + " entry #" + index + " has no name");
            }
            JsonNode category = entry.get("category");
            List<String> aliases = new ArrayList<>();
            JsonNode aliasNodes = entry.get("aliases");
            if (aliasNodes != null && aliasNodes.isArray()) {
                for (JsonNode alias : aliasNodes) {
                    if (alias.isTextual() && !alias.asText().isBlank()) {
                        aliases.add(alias.asText().strip());
                    }
                }
            }
            out.add(new SkillDefinition(
                name.asText().strip(),
                category != null && category.isTextual() ? category.asText().strip() : null,
                aliases));
            index++;
        }

        if (out.isEmpty()) {
            throw new SkillCatalogException("Skill catalog " + source + " contains no skills");
        }
        log.info("Loaded {} skills from {}", out.size(), source);
        return new SkillCatalog(out);
    }

    public List<SkillDefinition> skills() {
        return skills;
    }

    public List<String> canonicalNames() {
        return skills.stream()
            .map(SkillDefinition::name)
            .distinct()
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    public int size() {
        return skills.size();
    }
}

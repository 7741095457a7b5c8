package com.skillpulse.processing.text;

import java.util.List;
import java.util.Objects;

public record SkillDefinition(String name, String category, List<String> aliases) {

    public static final String UNKNOWN_CATEGORY = "Unknown";

    public SkillDefinition {
        Objects.requireNonNull(name, "name");
        category = (category == null || category.isBlank()) ? UNKNOWN_CATEGORY : category;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}

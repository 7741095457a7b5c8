package com.skillpulse.processing.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable lookup from lowercased alias to canonical skill name, built once from the catalog
 * and shared by every extraction call.
 *
 * <p>Aliases are registered in catalog order and a later alias overwrites an earlier one with
 * the same lowercased form. Canonical names are registered last, so each canonical name always
 * resolves to itself.
 *
 * <p>{@link #matchOrder()} lists the aliases sorted by descending length, ties broken by the
 * alias string. Extraction relies on that order to try specific aliases ("node.js") before
 * their shorter prefixes ("node").
 */
public final class AliasIndex {

    private static final Logger log = LoggerFactory.getLogger(AliasIndex.class);

    static final Comparator<String> MATCH_ORDER =
        Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    // letters, digits and underscore count as word characters on either side of an alias
    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";

    private final Map<String, String> aliasToSkill;
    private final Map<String, String> categories;
    private final List<AliasPattern> matchOrder;

    private AliasIndex(Map<String, String> aliasToSkill, Map<String, String> categories) {
        this.aliasToSkill = Collections.unmodifiableMap(aliasToSkill);
        this.categories = Collections.unmodifiableMap(categories);

        List<String> aliases = new ArrayList<>(aliasToSkill.keySet());
        aliases.sort(MATCH_ORDER);
        List<AliasPattern> patterns = new ArrayList<>(aliases.size());
        for (String alias : aliases) {
            patterns.add(new AliasPattern(alias, aliasToSkill.get(alias), wholeWord(alias)));
        }
        this.matchOrder = List.copyOf(patterns);
    }

    public static AliasIndex of(SkillCatalog catalog) {
        return of(catalog.skills());
    }

    public static AliasIndex of(List<SkillDefinition> definitions) {
        Map<String, String> aliasToSkill = new LinkedHashMap<>();
        Map<String, String> categories = new LinkedHashMap<>();

        for (SkillDefinition def : definitions) {
            categories.put(def.name(), def.category());
            for (String alias : def.aliases()) {
                String key = key(alias);
                if (key.isEmpty()) continue;
                String previous = aliasToSkill.put(key, def.name());
                if (previous != null && !previous.equals(def.name())) {
                    log.debug("Alias '{}' reassigned from {} to {}", key, previous, def.name());
                }
            }
        }
        for (SkillDefinition def : definitions) {
            aliasToSkill.put(key(def.name()), def.name());
        }

        log.debug("Built alias index with {} aliases for {} skills", aliasToSkill.size(), categories.size());
        return new AliasIndex(aliasToSkill, categories);
    }

    public Optional<String> resolve(String aliasOrName) {
        if (aliasOrName == null) return Optional.empty();
        return Optional.ofNullable(aliasToSkill.get(key(aliasOrName)));
    }

    public Optional<String> categoryOf(String skill) {
        return Optional.ofNullable(categories.get(skill));
    }

    public List<AliasPattern> matchOrder() {
        return matchOrder;
    }

    public List<String> canonicalNames() {
        return categories.keySet().stream().sorted().toList();
    }

    public Map<String, String> asMap() {
        return aliasToSkill;
    }

    public int size() {
        return aliasToSkill.size();
    }

    private static String key(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }

    private static Pattern wholeWord(String alias) {
        return Pattern.compile(
            "(?<!" + WORD_CHAR + ")" + Pattern.quote(alias) + "(?!" + WORD_CHAR + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public record AliasPattern(String alias, String skill, Pattern pattern) {}
}

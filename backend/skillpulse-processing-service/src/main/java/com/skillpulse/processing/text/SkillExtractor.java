package com.skillpulse.processing.text;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds catalog skills mentioned in free text.
 *
 * <p>Aliases are tried longest first. An occurrence is accepted only when it is a whole word and
 * does not overlap text already claimed by a longer alias, so "node.js" shadows "node" and
 * "script" never matches inside "typescript". The first alias of a skill that matches wins;
 * later aliases of the same skill are not recorded again. No semantic disambiguation is done.
 *
 * <p>Stateless apart from the immutable {@link AliasIndex}; safe for concurrent use.
 */
public class SkillExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AliasIndex index;

    public SkillExtractor(AliasIndex index) {
        this.index = index;
    }

    public List<ExtractedSkill> extract(String text) {
        if (text == null || text.isBlank()) return List.of();
        String norm = normalizeText(text);

        BitSet claimed = new BitSet(norm.length());
        Set<String> found = new HashSet<>();
        List<ExtractedSkill> out = new ArrayList<>();

        for (AliasIndex.AliasPattern candidate : index.matchOrder()) {
            boolean matched = claim(candidate.pattern(), norm, claimed);
            if (matched && found.add(candidate.skill())) {
                out.add(new ExtractedSkill(candidate.skill(), categoryOf(candidate.skill())));
            }
        }

        out.sort(Comparator.comparing(ExtractedSkill::skill));
        return out;
    }

    public String normalize(String skillOrAlias) {
        if (skillOrAlias == null || skillOrAlias.isBlank()) return skillOrAlias;
        return index.resolve(skillOrAlias).orElse(skillOrAlias);
    }

    public boolean isKnown(String skillOrAlias) {
        return index.resolve(skillOrAlias).isPresent();
    }

    public List<String> listAll() {
        return index.canonicalNames();
    }

    public String categoryOf(String skill) {
        return index.categoryOf(skill).orElse(SkillDefinition.UNKNOWN_CATEGORY);
    }

    public Optional<String> findCategory(String skill) {
        return index.categoryOf(skill);
    }

    static String normalizeText(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    // Claims every free occurrence of the pattern; true if at least one was free.
    private static boolean claim(Pattern pattern, String text, BitSet claimed) {
        Matcher m = pattern.matcher(text);
        boolean any = false;
        while (m.find()) {
            int start = m.start();
            int end = m.end();
            int taken = claimed.nextSetBit(start);
            if (taken >= 0 && taken < end) continue;
            claimed.set(start, end);
            any = true;
        }
        return any;
    }
}

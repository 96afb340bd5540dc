package com.eainde.cds.service;

import com.eainde.cds.config.ExtractionProperties;

import java.util.Locale;

/**
 * The two spellings of a school argument: a title-cased display name and a lower-case slug.
 *
 * <pre>
 * SchoolName.of("brown")         → ("Brown", "brown")
 * SchoolName.of("UCLA")          → ("Ucla", "ucla")
 * SchoolName.of("penn-state")    → ("Penn-State", "penn-state")
 * SchoolName.of("ucla", "UCLA")  → ("UCLA", "ucla")
 * </pre>
 */
public record SchoolName(String displayName, String slug) {

    public static SchoolName of(String school) {
        return of(school, null);
    }

    /**
     * The school's names, with the display name its configured profile sets, if any.
     */
    public static SchoolName configured(String school, ExtractionProperties properties) {
        SchoolName plain = of(school);
        return of(school, properties.profile(plain.slug()).getDisplayName());
    }

    /**
     * @param displayName configured display name, used as is; blank or null means title case
     */
    public static SchoolName of(String school, String displayName) {
        if (school == null || school.isBlank()) {
            throw new IllegalArgumentException("School name is required");
        }
        String trimmed = school.strip();
        String display = displayName == null || displayName.isBlank() ? titleCase(trimmed) : displayName.strip();
        return new SchoolName(display, trimmed.toLowerCase(Locale.ROOT));
    }

    /** Upper-cases the first letter of every letter run and lower-cases the rest. */
    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}

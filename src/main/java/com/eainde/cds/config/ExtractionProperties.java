package com.eainde.cds.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Extraction settings bound from the {@code cds} prefix of application.yml.
 *
 * <pre>
 * cds:
 *   output-dir: src/data/schools
 *   pdf-root: ./College-Data
 *   schools:
 *     ucla:
 *       display-name: UCLA
 *       gendered-admissions: true
 *       line-scans: true
 *       undergraduate-min: 25000
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "cds")
public class ExtractionProperties {

    /** Directory receiving {@code <slug>.json}. */
    private String outputDir = "src/data/schools";

    /** Root holding one document directory per school, named by the title-cased school. */
    private String pdfRoot = "./College-Data";

    /** Institution-specific profiles keyed by slug. */
    private Map<String, SchoolProfile> schools = new LinkedHashMap<>();

    /**
     * @return the school's profile, or the defaults when none is configured
     */
    public SchoolProfile profile(String slug) {
        if (slug == null) return SchoolProfile.defaults();
        SchoolProfile profile = schools.get(slug.toLowerCase(Locale.ROOT));
        return profile != null ? profile : SchoolProfile.defaults();
    }
}

package com.eainde.cds.service;

import com.eainde.cds.config.ExtractionProperties;
import com.eainde.cds.config.SchoolProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchoolNameTest {

    @Test
    @DisplayName("should title-case every word and lower-case the slug")
    void spellings() {
        assertThat(SchoolName.of("brown")).isEqualTo(new SchoolName("Brown", "brown"));
        assertThat(SchoolName.of("UCLA")).isEqualTo(new SchoolName("Ucla", "ucla"));
        assertThat(SchoolName.of("penn-state")).isEqualTo(new SchoolName("Penn-State", "penn-state"));
    }

    @Test
    @DisplayName("should require a name")
    void required() {
        assertThatThrownBy(() -> SchoolName.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a configured display name is used as is; a blank one falls back to title case")
    void displayNameOverride() {
        assertThat(SchoolName.of("ucla", "UCLA")).isEqualTo(new SchoolName("UCLA", "ucla"));
        assertThat(SchoolName.of("ucla", " ")).isEqualTo(new SchoolName("Ucla", "ucla"));
    }

    @Test
    @DisplayName("should take the display name from the school's profile")
    void configured() {
        SchoolProfile ucla = new SchoolProfile();
        ucla.setDisplayName("UCLA");
        ExtractionProperties properties = new ExtractionProperties();
        properties.getSchools().put("ucla", ucla);

        assertThat(SchoolName.configured("UCLA", properties)).isEqualTo(new SchoolName("UCLA", "ucla"));
        assertThat(SchoolName.configured("brown", properties)).isEqualTo(new SchoolName("Brown", "brown"));
    }
}

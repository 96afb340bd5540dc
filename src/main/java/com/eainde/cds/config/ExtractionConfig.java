package com.eainde.cds.config;

import com.eainde.cds.rules.TextRuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {

    @Bean
    public TextRuleSet textRuleSet() {
        return TextRuleSet.STANDARD;
    }

    /**
     * Mapper for report output: indented, no failure on records without properties.
     */
    @Bean
    public ObjectMapper reportObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}

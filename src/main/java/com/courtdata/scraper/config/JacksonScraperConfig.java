package com.courtdata.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class JacksonScraperConfig {

    /**
     * The application {@link ObjectMapper}; MVC picks it up in place of Boot's default mapper.
     * <p>
     * Built from Boot's {@link Jackson2ObjectMapperBuilder} so the
     * <code>spring.jackson.*</code> settings still apply. Dates are written as
     * ISO strings.
     *
     * @param builder Boot-configured builder
     * @return ObjectMapper qualified as <b>scraperObjectMapper</b>
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper(final Jackson2ObjectMapperBuilder builder) {

        ObjectMapper mapper = builder.build();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }

}

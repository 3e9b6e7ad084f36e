package com.courtdata.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file from the working directory and adds its entries
 * as the first property source, so values such as
 * `COURT_SITE_BASE_URL` or `SPRING_DATASOURCE_PASSWORD` override application.yml.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String SOURCE_NAME = "dotenvProperties";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(env.getProperty("court.dotenv.filename", ".env"))
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));
        if (map.isEmpty()) {
            return;
        }

        env.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, map));
    }
}

package com.duckide.practice.config;

import com.duckide.practice.catalog.CatalogLoadException;
import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.service.ExerciseImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Configuration
public class CatalogConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CatalogConfiguration.class);

    @Bean
    public ExerciseCatalog exerciseCatalog(PracticeProperties properties,
                                           ResourceLoader resourceLoader,
                                           ExerciseImportService importService) {
        String location = properties.catalog().location();
        Resource resource = resourceLoader.getResource(location);
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogLoadException(location, e);
        }

        ExerciseCatalog catalog = importService.importCatalog(location, content);
        logger.info("Exercise catalog loaded from {}: {} exercise(s)", location, catalog.count());
        return catalog;
    }
}

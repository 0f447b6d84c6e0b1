package com.walkierelay.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves stored clips under {@code /audio/**} and opens the HTTP API to any origin.
 */
@Configuration
public class MediaWebConfig implements WebMvcConfigurer {

    @Value("${walkie.media.dir:audio_temp}")
    private String mediaDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Paths.get(mediaDir).toAbsolutePath().toUri().toString();
        if (!location.endsWith("/")) location = location + "/";
        registry.addResourceHandler("/audio/**").addResourceLocations(location);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**").allowedOrigins("*").allowedMethods("GET", "POST");
    }
}

package com.aegis.aegis_intel_api.config;

import com.aegis.aegis_intel_api.service.storage.UploadStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves stored uploads and annotated images under /static/uploads/.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final UploadStorageService uploadStorageService;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = uploadStorageService.getUploadRoot().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler("/static/uploads/**").addResourceLocations(location);
    }
}

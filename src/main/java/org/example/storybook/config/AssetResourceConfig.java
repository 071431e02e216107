package org.example.storybook.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves stored assets under the public path when no CDN fronts them.
 */
@Configuration
public class AssetResourceConfig implements WebMvcConfigurer {

    @Value("${assets.storage-dir:./data/assets}")
    private String storageDir;

    @Value("${assets.public-path:/assets}")
    private String publicPath;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String path = publicPath == null || publicPath.isBlank() ? "/assets/" : publicPath.trim();
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        String location = Paths.get(storageDir).toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(path + "**").addResourceLocations(location);
    }
}

package com.paxkun.magpie.config;

import com.paxkun.magpie.service.storage.LocalFileBlobSink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;
import java.util.List;

/**
 * CORS for browser callers, and {@code /images/**} for locally stored images.
 * The image handler is skipped when S3 storage is active.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ObjectProvider<LocalFileBlobSink> localSink;
    private final MagpieProperties properties;

    public WebConfig(ObjectProvider<LocalFileBlobSink> localSink, MagpieProperties properties) {
        this.localSink = localSink;
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = properties.getWeb().getAllowedOrigins();
        registry.addMapping("/**")
                .allowedOriginPatterns(origins.isEmpty() ? new String[]{"*"} : origins.toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Origin", "X-Requested-With", "Content-Type", "Accept", "Authorization")
                .allowCredentials(true);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        LocalFileBlobSink sink = localSink.getIfAvailable();
        if (sink == null) {
            return;
        }
        String location = sink.getRoot().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        int cacheSeconds = (int) Duration.ofDays(properties.getStorage().getLocal().getCacheDays()).toSeconds();
        registry.addResourceHandler("/images/**")
                .addResourceLocations(location)
                .setCachePeriod(cacheSeconds);
    }
}

package com.seatview.viewer.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for the seat view API.
 *
 * <p>CORS is only enabled for {@code /api/**} and only when an origin allowlist is configured.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final ViewerProperties properties;

  public WebConfig(ViewerProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders("X-Seatview-Fingerprint", "X-Seatview-Section", "X-Seatview-Resolution")
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }
}

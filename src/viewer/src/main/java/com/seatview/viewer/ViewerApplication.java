package com.seatview.viewer;

import com.seatview.viewer.config.ViewerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot entrypoint for the seat view service.
 *
 * <p>Turns seatmap clicks into camera poses and serves the rendered views through a shared
 * in-memory cache.
 */
@SpringBootApplication
@EnableConfigurationProperties(ViewerProperties.class)
public class ViewerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ViewerApplication.class, args);
  }
}

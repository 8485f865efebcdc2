package com.scholary.discussion.config;

import java.nio.file.Path;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Serves generated clips under {@code /clips/**} straight from the clips directory. */
@Configuration
public class ClipResourceConfig implements WebMvcConfigurer {

  private final PipelineProperties properties;

  public ClipResourceConfig(PipelineProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    String location = Path.of(properties.clipsDir()).toAbsolutePath().toUri().toString();
    registry.addResourceHandler("/clips/**").addResourceLocations(location);
  }
}

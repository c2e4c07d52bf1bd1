package guraa.formcompare.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final AppProperties properties;

    public WebCorsConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        AppProperties.Cors cors = properties.getCors();
        if (cors.getAllowedOrigins().isEmpty()) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedOrigins(cors.getAllowedOrigins().toArray(new String[0]))
                .allowedMethods(cors.getAllowedMethods().isEmpty()
                        ? new String[]{"GET", "POST", "OPTIONS"}
                        : cors.getAllowedMethods().toArray(new String[0]))
                .allowedHeaders("*")
                .maxAge(cors.getMaxAge());
    }
}

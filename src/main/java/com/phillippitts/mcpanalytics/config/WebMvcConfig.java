package com.phillippitts.mcpanalytics.config;

import com.phillippitts.mcpanalytics.presentation.interceptor.RequestTrackingInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers request tracking for every controller route and opens the API to browser clients.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    static final String SESSION_HEADER = "Mcp-Session-Id";

    private final RequestTrackingInterceptor requestTrackingInterceptor;

    public WebMvcConfig(RequestTrackingInterceptor requestTrackingInterceptor) {
        this.requestTrackingInterceptor = requestTrackingInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestTrackingInterceptor);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type", "Accept", "Authorization", SESSION_HEADER)
                .exposedHeaders(SESSION_HEADER);
    }
}

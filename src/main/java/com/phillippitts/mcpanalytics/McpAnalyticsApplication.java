package com.phillippitts.mcpanalytics;

import com.phillippitts.mcpanalytics.config.properties.AnalyticsProperties;
import com.phillippitts.mcpanalytics.config.properties.McpServerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AnalyticsProperties.class,
        McpServerProperties.class
})
public class McpAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpAnalyticsApplication.class, args);
    }

}

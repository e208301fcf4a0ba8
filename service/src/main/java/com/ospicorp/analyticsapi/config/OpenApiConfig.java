package com.ospicorp.analyticsapi.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI analyticsApi(@Value("${spring.application.name:analytics-api}") String serviceName) {
    return new OpenAPI()
        .info(new Info()
            .title("Tabular Analytics API")
            .version("v1")
            .description("Schema inference, insights, forecasting, anomaly detection and "
                + "cleaning of uploaded tabular datasets. Served by " + serviceName + ".")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .tags(List.of(
            new Tag().name("Analytics")
                .description("Insights, forecasts, anomalies, profiles and cleaning"),
            new Tag().name("Query").description("Natural-language questions about a dataset")))
        .externalDocs(new ExternalDocumentation()
            .description("Error and problem types")
            .url("https://docs.analytics-api.dev/problems/"));
  }
}

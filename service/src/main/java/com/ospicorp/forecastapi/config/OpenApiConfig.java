package com.ospicorp.forecastapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Smart Forecasting API")
            .version("v1")
            .description("Model training jobs and on-demand forecasts for registered data sources")
            .contact(new Contact().name("Forecasting Team").email("forecasting@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}

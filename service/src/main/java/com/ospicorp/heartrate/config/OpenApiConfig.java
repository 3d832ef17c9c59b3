package com.ospicorp.heartrate.config;

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
            .title("Heart Rate Time Series API")
            .version("v1")
            .description("Heart rate queries with automatic granularity selection and interval re-aggregation")
            .contact(new Contact().name("Time Series Platform Team").email("api-support@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}

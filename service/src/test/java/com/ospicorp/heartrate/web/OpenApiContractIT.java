package com.ospicorp.heartrate.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.heartrate.support.TimescaleContainerSupport;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiContractIT extends TimescaleContainerSupport {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void openapiDocumentIsValidAndListsQueryEndpoints() {
    String yaml = rest.getForObject("/v3/api-docs.yaml", String.class);
    ParseOptions options = new ParseOptions();
    options.setResolve(true);
    SwaggerParseResult result = new OpenAPIV3Parser().readContents(yaml, null, options);

    assertThat(result.getMessages()).as("validation messages").isEmpty();
    OpenAPI openApi = result.getOpenAPI();
    assertThat(openApi).isNotNull();
    assertThat(openApi.getPaths()).containsKeys("/timeseries", "/multi-user/timeseries", "/users", "/health");
    assertThat(openApi.getPaths().get("/timeseries").getGet().getParameters())
        .extracting(parameter -> parameter.getName())
        .contains("start_date", "end_date", "user_id", "interval", "format");
  }
}

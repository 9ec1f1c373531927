package csw.crawler.render.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// http://localhost:8080/swagger-ui/index.html#/ -> Swagger UI
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI crawlerRenderOpenAPI(@Value("${render.pool.size:5}") int poolSize) {
        Info info = new Info()
                .title("crawler-render API")
                .version("0.0.1")
                .description("Fetches pages for the crawler, rendering flagged requests in a pool of "
                        + poolSize + " browser sessions")
                .license(new License().name("Apache License Version 2.0").url("http://www.apache.org/licenses/LICENSE-2.0"));

        return new OpenAPI()
                .components(new Components())
                .info(info);
    }
}

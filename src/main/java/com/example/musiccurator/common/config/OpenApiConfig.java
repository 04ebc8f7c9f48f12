package com.example.musiccurator.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicCuratorOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Curator API")
                        .description("Library indexing, import vetting and duplicate cleanup")
                        .version("v1")
                        .contact(new Contact().name("music-curator")));
    }
}

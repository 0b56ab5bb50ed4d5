package com.rankbox.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rankboxOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("RankBox Ranking API")
                        .description("Ranks a list of items from pairwise and group choices. " +
                                "One session at a time; outcomes are applied in batches and audited for consistency.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}

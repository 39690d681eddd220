package com.xksgroup.hlstranscoder.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int port) {

        Server localDev = new Server()
                .url("http://localhost:" + port)
                .description("Local development");

        return new OpenAPI()
                .info(new Info()
                        .title("HLS Transcoder API")
                        .version("v1")
                        .description("Transcode job submission, job status and master playlist retrieval"))
                .servers(List.of(localDev));
    }
}

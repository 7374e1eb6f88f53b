package com.tripmate.routeplanner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:4000}")
    private int serverPort;

    @Bean
    public OpenAPI routePlannerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TripMate Route Planner API")
                        .description("""
                                Orders trip waypoints into a visiting sequence and estimates each leg.

                                - **Route**: nearest-neighbor ordering with per-segment distance/duration
                                - **Providers**: Kakao Mobility (road) and ODsay (public transit), tried per transport mode
                                - **Fallback**: great-circle estimate when no provider is configured or all fail
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("TripMate Team")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}

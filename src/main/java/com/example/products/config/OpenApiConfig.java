package com.example.products.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Products API",
        version = "1.0.0",
        description = "CRUD endpoints for the product catalog. All routes are public."),
    servers = @Server(url = "http://localhost:8080", description = "Local Development"))
public class OpenApiConfig {}

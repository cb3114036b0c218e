package com.turnstile.verification.config;

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

    @Value("${server.port:9000}")
    private String serverPort;

    @Bean
    public OpenAPI verificationServiceOpenAPI() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        Contact contact = new Contact()
                .name("Turnstile Platform Team");

        Info info = new Info()
                .title("Verification Service API")
                .version("1.0.0")
                .description("Verification Service decides whether a scanned ticket may pass the gate. " +
                            "It checks the token signature, issuer, validity, event, blacklist and revocation, " +
                            "serializes scans of the same ticket with a Redis lock, and enforces event capacity " +
                            "and re-entry limits. Jobs can also be replayed asynchronously through Kafka.")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}

package com.fintech.lightning.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI lightningWalletOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lightning Wallet Adapter API")
                        .description("Wallet operations over a Lightning node. Invoices are identified by their hex payment hash, "
                                + "outgoing payments by the node's payment index. Settlements and payment status changes are "
                                + "pushed over Server-Sent Events; payment updates are delivered at least once.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FinTech Team")
                                .email("fintech@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .tags(List.of(
                        new Tag().name("Wallet").description("Balance, invoices, payments and their event streams")))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local node adapter")
                ));
    }
}

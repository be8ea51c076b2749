package tech.noetzold.risk_engine.config;

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
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8095}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Risk Engine API")
                        .version("1.0.0")
                        .description("Avaliação de confiança e risco de apps instalados, com baseline, incidentes e causa raiz")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Servidor de Desenvolvimento"),
                        new Server()
                                .url("https://api.noetzold.tech")
                                .description("Servidor de Produção")))
                .tags(List.of(
                        new Tag().name("Scan").description("Avaliação de apps e baseline"),
                        new Tag().name("Incidents").description("Incidentes de segurança e ciclo de vida"),
                        new Tag().name("Config").description("Monitoramento de configuração do dispositivo")));
    }
}

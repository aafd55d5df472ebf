package co.fanki.flowgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Flow Graph Engine.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Flow Graph Engine API")
                        .description("""
                                Flow Graph Engine - builds control-flow graphs from
                                language-agnostic ASTs and analyzes their structure.

                                ## Features
                                - **Build**: translate an AST into a graph of control points
                                - **Diagnose**: orphan edges, disconnected nodes, entry checks
                                - **Analyze**: dominators, back edges, loop headers, critical edges, reducibility
                                - **Export**: Mermaid, Graphviz DOT and JSON with styling hints

                                ## Endpoints
                                - `POST /api/cfg/sessions` - Analyze an AST
                                - `POST /api/cfg/sessions/batch` - Analyze several ASTs
                                - `POST /api/cfg/diagnose` - Diagnose a raw graph
                                - `GET /api/cfg/sessions/{id}/summary` - Text summary
                                - `GET /api/cfg/sessions/{id}/export` - Rendered graph
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}

package com.logimatrix.tracking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for API documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI trackingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Real-Time Tracking & Spatial Alert API")
                        .description("Ingests GPS fixes and telemetry from fleet vehicles, keeps the latest position " +
                                "and track history, and raises geofence and accident-proximity alerts.\n\n" +
                                "## Flow\n\n" +
                                "1. Fixes arrive via REST or STOMP and are serialized per vehicle\n" +
                                "2. Latest position is cached (Redis) and the track history is appended (PostgreSQL)\n" +
                                "3. Geofence and accident-proximity engines evaluate the fix in parallel\n" +
                                "4. location_update, geofence_alert and accident_proximity_alert events go to " +
                                "vehicle:, shipment: and tenant: rooms; alerts are logged for 90 days\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/tracking` (STOMP).\n\n" +
                                "- `/app/tracking/fix`, `/app/tracking/fix/batch` - send fixes\n" +
                                "- `/app/tracking/telemetry` - send telemetry\n" +
                                "- `/app/tracking/join`, `/app/tracking/leave` - `{\"topic\":\"vehicle:VH-1\"}`\n" +
                                "- `/user/queue/events` - receive events of joined rooms\n" +
                                "- `/user/queue/reply` - receive acknowledgements")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tracking Platform Team")
                                .email("tracking@logimatrix.example")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}

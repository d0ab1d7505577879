package com.eyelevel.lotprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Lot Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API accepts batches of vehicle lots (images plus metadata) and produces
                                English damage descriptions with optional translations, using an asynchronous
                                batch inference provider.

                                Key features include:
                                * **Asynchronous Batches:** Jobs are accepted immediately and reconciled in the background.
                                * **Two Inference Phases:** Vision analysis first, then translation into the requested languages.
                                * **Signed Webhooks:** Results are pushed to client endpoints with an HMAC-SHA256 signature and bounded retries.
                                * **Monitoring:** Delivery metrics, endpoint health and alerts for operators.

                                **Note:** Cancelling a job stops local processing only. The remote batch keeps running.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}

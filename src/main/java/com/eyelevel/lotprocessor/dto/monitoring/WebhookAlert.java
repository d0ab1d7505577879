package com.eyelevel.lotprocessor.dto.monitoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A condition of the delivery system that needs attention.
 *
 * @param endpoint The affected URL, for endpoint alerts only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAlert(Level level, String message, String metric, Double value, String endpoint) {

    public enum Level {
        WARNING("warning"),
        ERROR("error");

        private final String label;

        Level(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}

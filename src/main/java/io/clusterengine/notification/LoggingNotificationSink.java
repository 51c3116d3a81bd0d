package io.clusterengine.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each event to the log as a JSON document.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public void emit(ActionEvent event) {
        try {
            log.info("Action event: {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event for action {}: {}", event.getActionId(), e.getMessage());
        }
    }
}

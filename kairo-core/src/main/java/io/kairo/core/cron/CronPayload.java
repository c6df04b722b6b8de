package io.kairo.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the job asks the host to do. The engine never interprets it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronPayload(
    String message,
    boolean deliver,
    String channel,
    String to
) {

    public CronPayload {
        message = message == null ? "" : message;
    }

    public static CronPayload message(String message) {
        return new CronPayload(message, false, null, null);
    }
}

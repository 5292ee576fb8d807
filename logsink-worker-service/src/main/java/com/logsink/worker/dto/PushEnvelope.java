package com.logsink.worker.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import lombok.Data;

/**
 * Body of a push delivery:
 * <pre>
 *   { "message": { "data": "&lt;base64&gt;", "messageId": "...", "attributes": {...} },
 *     "subscription": "..." }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushEnvelope {

    private Message message;

    private String subscription;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        /** Base64-encoded canonical record JSON. */
        private String data;

        @JsonAlias("message_id")
        private String messageId;

        @JsonAlias("publish_time")
        private String publishTime;

        private Map<String, String> attributes;
    }
}

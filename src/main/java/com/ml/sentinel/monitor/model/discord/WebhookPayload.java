package com.ml.sentinel.monitor.model.discord;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Webhook body: a single rich embed per alert.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebhookPayload {

    private List<Embed> embeds;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Embed {
        private String title;
        private String description;
        private int color;
        private List<Field> fields;
        private Footer footer;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Field {
        private String name;
        private String value;
        private boolean inline;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Footer {
        private String text;
    }
}

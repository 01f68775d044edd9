package com.mouse.listings.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.List;

/**
 * Desktop browser fingerprint used to dress a session. Loaded from {@code static/devices.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserAgentProfile {
    private String id;
    private String userAgent;
    private Viewport viewport;
    private String platform;
    private Integer hardwareConcurrency;
    private Integer deviceMemory;
    private String timeZone;
    private String locale;
    private List<String> languages;
    private Webgl webgl;
    private ClientHints clientHints;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Viewport {
        private Integer width;
        private Integer height;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Webgl {
        private String vendor;
        private String renderer;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClientHints {
        private List<Brand> brands;
        private boolean mobile;
        private String platform;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Brand {
            private String brand;
            private String version;
        }
    }
}

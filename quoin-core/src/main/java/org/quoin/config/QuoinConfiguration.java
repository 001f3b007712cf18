package org.quoin.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class QuoinConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("quoting")
        private QuotingConfiguration quoting;
    }

    /**
     * 식별자 quote 관련 설정
     */
    @Data
    public static class QuotingConfiguration {

        @JsonProperty("dialect")
        private String dialect;

        @JsonProperty("mode")
        private String mode;

        @JsonProperty("policy")
        private String policy;
    }
}

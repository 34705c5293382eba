package org.arena.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 浏览器扩展推送的 token、cookies、models
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtensionPushRequest {

    @Size(max = 64, message = "profile_id 过长")
    private String profileId;

    @NotNull(message = "cookies 不能为空")
    private Map<String, String> cookies;

    private String authToken;

    private String cfClearance;

    @Valid
    private List<TokenItem> v3Tokens;

    @Valid
    private TokenItem v2Token;

    private List<ModelItem> models;

    private Map<String, String> nextActions;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TokenItem {
        @NotBlank(message = "token 不能为空")
        private String token;
        private String action;
        @PositiveOrZero(message = "age_ms 不能为负数")
        private Long ageMs;
    }

    /**
     * 页面上拿到的模型定义，字段沿用上游的驼峰命名
     */
    @Data
    public static class ModelItem {
        private String id;
        private String publicName;
        private String name;
        private String category;
        private Capabilities capabilities;
    }

    @Data
    public static class Capabilities {
        private List<String> inputCapabilities;
        private List<String> outputCapabilities;
    }
}

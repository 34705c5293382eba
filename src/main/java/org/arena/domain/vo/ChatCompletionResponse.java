package org.arena.domain.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatCompletionResponse {
    private String id;
    private String object;
    // 以下三个字段只对 Claude 系客户端输出
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String type;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String role;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ContentBlock> content;
    private Long created;
    private String model;
    private List<Choice> choices;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Usage usage;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Choice {
        private Integer index;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private Delta delta;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private Message message;
        private String finishReason;

        @Data
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
        public static class Delta {
            private String role;
            private String content;
            private String reasoningContent;
        }

        @Data
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
        public static class Message {
            private String role;
            private String content;
            private String reasoningContent;
        }
    }

    @Data
    public static class ContentBlock {
        private String type;
        private String text;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Usage {
        private Integer promptTokens;
        private Integer completionTokens;
        private Integer totalTokens;
    }
}

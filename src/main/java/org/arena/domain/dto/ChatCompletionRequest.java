package org.arena.domain.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import java.util.List;

@Data
public class ChatCompletionRequest {
    @NotBlank(message = "model 不能为空")
    private String model;
    @NotEmpty(message = "messages 不能为空")
    @Valid
    private List<Message> messages;
    private Boolean stream;

    @Data
    public static class Message {
        @NotNull(message = "role 不能为空")
        private String role;
        // 字符串，或 [{"type": "text", "text": ...}, {"type": "image_url", ...}] 形式的多模态数组
        private Object content;
    }
}

package org.arena.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtensionPushResponse {
    private String status;
    private String profileId;
    private Integer poolMax;
    // 为 true 时扩展应加快生成凭证
    private Boolean needTokens;
    private Integer v3Count;
}

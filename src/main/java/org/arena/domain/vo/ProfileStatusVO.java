package org.arena.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfileStatusVO {
    private String profileId;
    private Boolean active;
    private Double health;
    // 距上次推送的秒数
    private Double lastPushAgo;
    private Integer v3Tokens;
    private Boolean hasV2;
    private Boolean hasAuth;
    private Boolean hasCf;
    private Long pushCount;
    private Long errorCount;
    private Integer recentErrors;
    private List<String> nextActions;
    private List<String> cookies;
}

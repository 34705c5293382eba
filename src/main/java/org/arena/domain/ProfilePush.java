package org.arena.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 已校验、已转换的一次推送内容
 */
@Value
@Builder
public class ProfilePush {

    @Singular("cookie")
    Map<String, String> cookies;
    String authToken;
    String cfClearance;
    @Singular
    List<Credential> credentials;
    Credential fallback;
    // 上游页面 server action 名称 -> 哈希
    @Singular("nextAction")
    Map<String, String> nextActions;
}

package org.arena.domain;

import lombok.Value;

import java.util.Map;

/**
 * 调度结果：选中账号的会话材料副本 + 已消耗的凭证。
 * 副本在锁内生成，之后的网络请求不再访问账号的共享状态
 */
@Value
public class DispatchTicket {

    String profileId;
    Map<String, String> cookies;
    String authToken;
    String cfClearance;
    Credential credential;
}

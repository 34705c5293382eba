package org.arena.service;

import org.arena.domain.dto.ExtensionPushRequest;
import org.arena.domain.vo.ExtensionPushResponse;

import java.util.Map;

public interface IExtensionService {

    /**
     * 合并一次推送，调用前推送密钥已校验
     */
    ExtensionPushResponse push(ExtensionPushRequest request);

    /**
     * 各账号的凭证数量、健康度、最近推送时间
     */
    Map<String, Object> status();
}

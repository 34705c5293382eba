package org.arena.service;

import org.arena.domain.ArenaModel;
import org.arena.domain.DispatchTicket;
import org.arena.domain.UpstreamRequest;
import org.arena.domain.dto.ChatCompletionRequest;

public interface IUpstreamRequestBuilder {

    /**
     * 把多轮消息压平成上游的单条输入。在取凭证之前调用，非法请求不消耗凭证
     *
     * @throws org.arena.domain.exception.BadRequestException 消息内容为空
     */
    String preparePrompt(ChatCompletionRequest request);

    UpstreamRequest build(DispatchTicket ticket, String prompt, ArenaModel model, String evaluationId);
}

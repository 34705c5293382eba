package org.arena.service;

import org.arena.domain.DispatchTicket;

public interface IDispatcher {

    /**
     * 没有任何活跃账号时直接拒绝，不消耗凭证
     *
     * @throws org.arena.domain.exception.ServiceUnavailableException 没有活跃账号
     */
    void admit(String requestId);

    /**
     * 按健康度依次尝试活跃账号，取到第一个可用凭证即返回。凭证一经取出不会归还
     *
     * @throws org.arena.domain.exception.ServiceUnavailableException 没有活跃账号或全部耗尽
     */
    DispatchTicket acquire(String requestId);
}

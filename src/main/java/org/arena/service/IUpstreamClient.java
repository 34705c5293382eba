package org.arena.service;

import org.arena.domain.UpstreamRequest;

import java.io.IOException;

public interface IUpstreamClient {

    UpstreamResponse execute(UpstreamRequest request) throws IOException;
}

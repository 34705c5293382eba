package org.arena.domain;

import lombok.Value;

import java.util.Map;

@Value
public class UpstreamRequest {

    String url;
    Map<String, String> headers;
    String body;
    String evaluationId;
    String profileId;
}

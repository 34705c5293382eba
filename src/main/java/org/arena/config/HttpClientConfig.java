package org.arena.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient httpClient(ArenaProperties arenaProperties) {
        PoolingHttpClientConnectionManager connectionManager =
            new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(200);
        connectionManager.setDefaultMaxPerRoute(50);

        // 上游无响应时按超时失败，避免占满处理线程
        int timeout = arenaProperties.getTimeout();
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(timeout, TimeUnit.SECONDS)
            .setResponseTimeout(timeout, TimeUnit.SECONDS)
            .build();

        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

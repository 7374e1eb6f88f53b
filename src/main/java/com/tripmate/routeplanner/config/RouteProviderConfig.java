package com.tripmate.routeplanner.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.OkHttp3ClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients and the worker pool used for external distance providers.
 */
@Configuration
public class RouteProviderConfig {

    @Bean
    public RestTemplate kakaoRestTemplate(@Value("${route.providers.kakao.timeout-ms:4000}") long timeoutMs) {
        return restTemplateWithCallTimeout(timeoutMs);
    }

    @Bean
    public RestTemplate odsayRestTemplate(@Value("${route.providers.odsay.timeout-ms:4500}") long timeoutMs) {
        return restTemplateWithCallTimeout(timeoutMs);
    }

    /**
     * Runs provider calls so each can be awaited with its own deadline. With no queue every
     * submitted call gets a thread immediately, so a call's deadline never includes time spent
     * waiting behind other requests; once {@code max-size} calls are in flight new ones are
     * rejected and fall back.
     */
    @Bean
    public ThreadPoolTaskExecutor routeProviderExecutor(
            @Value("${route.providers.executor.core-size:8}") int coreSize,
            @Value("${route.providers.executor.max-size:64}") int maxSize,
            @Value("${route.providers.executor.queue-capacity:0}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("route-provider-");
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    // callTimeout spans connect, request and the whole response body; on expiry OkHttp cancels
    // the call and closes its socket, so a slow provider cannot hold a worker past its deadline
    @SuppressWarnings({"deprecation", "removal"})
    private static RestTemplate restTemplateWithCallTimeout(long timeoutMs) {
        Duration timeout = Duration.ofMillis(timeoutMs);
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
        return new RestTemplate(new OkHttp3ClientHttpRequestFactory(client));
    }
}

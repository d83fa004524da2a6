package dev.devanks.hlsarchive.harvester.config;

import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import feign.Logger.Level;
import feign.Request;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign configuration scoped to {@link dev.devanks.hlsarchive.harvester.client.CmrSearchClient}.
 * Not a {@code @Configuration} so that its beans stay out of the main context.
 */
@RequiredArgsConstructor
@Slf4j
public class CmrClientConfig {

    static final String CLIENT_ID_HEADER = "Client-Id";

    private final ArchiveProperties archiveProperties;

    @Bean
    public RequestInterceptor cmrHeadersInterceptor() {
        var clientId = archiveProperties.getCatalog().getClientId();
        return template -> {
            log.debug("Adding Client-Id header to CMR request {}", template.path());
            template.header(CLIENT_ID_HEADER, clientId);
            template.header(USER_AGENT, clientId + "/link-harvester");
        };
    }

    @Bean
    public Request.Options cmrRequestOptions() {
        var catalog = archiveProperties.getCatalog();
        return new Request.Options(catalog.getConnectTimeoutSeconds(), TimeUnit.SECONDS,
                catalog.getReadTimeoutSeconds(), TimeUnit.SECONDS, true);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}

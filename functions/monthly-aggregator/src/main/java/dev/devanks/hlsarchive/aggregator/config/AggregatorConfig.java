package dev.devanks.hlsarchive.aggregator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Slf4j
public class AggregatorConfig {

    // STAC item documents with many assets exceed the default 256 KB codec buffer
    private static final int MAX_ITEM_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient webClient(WebClient.Builder builder) {
        log.info("Initializing WebClient bean for STAC item fetches.");
        return builder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_ITEM_BYTES))
                .build();
    }
}

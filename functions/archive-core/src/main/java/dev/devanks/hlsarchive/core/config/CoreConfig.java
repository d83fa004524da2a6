package dev.devanks.hlsarchive.core.config;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import dev.devanks.hlsarchive.core.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class CoreConfig {

    /**
     * The S3 client is only needed for s3:// roots and s3:// item links, so it is built on first use.
     */
    @Bean
    public Supplier<AmazonS3> amazonS3Supplier(ArchiveProperties properties) {
        var region = properties.getStorage().getS3Region();
        return Suppliers.memoize(() -> {
            log.info("Initializing AmazonS3 client for region {}.", region);
            return AmazonS3ClientBuilder.standard()
                    .withRegion(region)
                    .withCredentials(DefaultAWSCredentialsProviderChain.getInstance())
                    .withClientConfiguration(new ClientConfiguration().withMaxConnections(200))
                    .build();
        });
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD;
    }
}

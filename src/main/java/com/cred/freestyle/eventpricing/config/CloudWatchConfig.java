package com.cred.freestyle.eventpricing.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;

/**
 * Publishes the pricing and booking metrics to AWS CloudWatch.
 * Turned off with cloud.aws.cloudwatch.enabled=false (tests, local runs), which
 * leaves Spring Boot's default in-memory registry in place.
 *
 * @author Event Pricing Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
public class CloudWatchConfig {

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:EventPricing}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private Duration step;

    @Value("${spring.application.name:event-pricing}")
    private String applicationName;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(
                new PricingCloudWatchConfig(namespace, batchSize, step),
                Clock.SYSTEM,
                cloudWatchAsyncClient
        );
        registry.config().commonTags("application", applicationName);
        return registry;
    }

    /**
     * Registry settings from application properties; everything else keeps Micrometer's defaults.
     */
    static class PricingCloudWatchConfig implements io.micrometer.cloudwatch2.CloudWatchConfig {

        private final String namespace;
        private final int batchSize;
        private final Duration step;

        PricingCloudWatchConfig(String namespace, int batchSize, Duration step) {
            this.namespace = namespace;
            this.batchSize = batchSize;
            this.step = step;
        }

        @Override
        public String get(String key) {
            return null;
        }

        @Override
        public String namespace() {
            return namespace;
        }

        @Override
        public int batchSize() {
            return batchSize;
        }

        @Override
        public Duration step() {
            return step;
        }
    }
}

package com.cred.freestyle.rewards.config;

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

import java.util.HashMap;
import java.util.Map;

/**
 * Ships the reward meters (operation outcomes, points moved, stock-outs) to CloudWatch.
 * Off unless rewards.metrics.cloudwatch.enabled=true; without it the meters stay in
 * the Actuator registry.
 *
 * @author Rewards Team
 */
@Configuration
@ConditionalOnProperty(name = "rewards.metrics.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient rewardsCloudWatchClient(@Value("${cloud.aws.region:us-east-1}") String region) {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry rewardsCloudWatchRegistry(
            CloudWatchAsyncClient rewardsCloudWatchClient,
            @Value("${cloud.aws.cloudwatch.namespace:RewardsLedger}") String namespace,
            @Value("${cloud.aws.cloudwatch.batch-size:20}") int batchSize,
            @Value("${cloud.aws.cloudwatch.step:PT1M}") String step
    ) {
        io.micrometer.cloudwatch2.CloudWatchConfig registryConfig =
                registrySettings(namespace, batchSize, step)::get;
        return new CloudWatchMeterRegistry(registryConfig, Clock.SYSTEM, rewardsCloudWatchClient);
    }

    /**
     * Micrometer reads every CloudWatch setting as "cloudwatch.&lt;name&gt;".
     */
    static Map<String, String> registrySettings(String namespace, int batchSize, String step) {
        Map<String, String> settings = new HashMap<>();
        settings.put("cloudwatch.namespace", namespace);
        settings.put("cloudwatch.batchSize", String.valueOf(batchSize));
        settings.put("cloudwatch.step", step);
        return settings;
    }
}

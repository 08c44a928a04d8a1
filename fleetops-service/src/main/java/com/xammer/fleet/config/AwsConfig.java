package com.xammer.fleet.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

@Configuration
public class AwsConfig {

    private static final Logger logger = LoggerFactory.getLogger(AwsConfig.class);

    @Value("${aws.region}")
    private String region;

    // Optional: role holding the fleet permissions, assumed on top of the default chain
    @Value("${aws.assume-role-arn:}")
    private String assumeRoleArn;

    @Value("${aws.role-session-name:fleetops-session}")
    private String roleSessionName;

    @Bean
    public StsClient stsClient() {
        return StsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public AwsCredentialsProvider fleetCredentialsProvider(StsClient stsClient) {
        if (assumeRoleArn == null || assumeRoleArn.isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        logger.info("Fleet AWS clients will assume role {}", assumeRoleArn);
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(stsClient)
                .refreshRequest(req -> req
                        .roleArn(assumeRoleArn)
                        .roleSessionName(roleSessionName))
                .build();
    }

    @Bean
    public Ec2Client ec2Client(AwsCredentialsProvider fleetCredentialsProvider) {
        return Ec2Client.builder()
                .region(Region.of(region))
                .credentialsProvider(fleetCredentialsProvider)
                .build();
    }

    @Bean
    public ElasticLoadBalancingV2Client elbv2Client(AwsCredentialsProvider fleetCredentialsProvider) {
        return ElasticLoadBalancingV2Client.builder()
                .region(Region.of(region))
                .credentialsProvider(fleetCredentialsProvider)
                .build();
    }

    @Bean
    public AutoScalingClient autoScalingClient(AwsCredentialsProvider fleetCredentialsProvider) {
        return AutoScalingClient.builder()
                .region(Region.of(region))
                .credentialsProvider(fleetCredentialsProvider)
                .build();
    }
}

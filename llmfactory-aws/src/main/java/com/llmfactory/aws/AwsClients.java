package com.llmfactory.aws;

import com.llmfactory.common.config.FactorySettings;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.ssm.SsmClient;

import java.time.Duration;

/**
 * Lazily built AWS SDK clients sharing one override configuration.
 * <p>
 * Clients are created on first use so that a factory working only with local
 * directories never needs AWS region or credentials. Region and credentials
 * come from the SDK default provider chains.
 */
@Slf4j
public class AwsClients implements AutoCloseable {

    private final ClientOverrideConfiguration overrides;

    private S3Client s3;
    private SsmClient ssm;
    private SecretsManagerClient secretsManager;

    public AwsClients(FactorySettings settings) {
        this(settings.getAwsApiCallTimeout());
    }

    public AwsClients(Duration apiCallTimeout) {
        this.overrides = overrideConfiguration(apiCallTimeout);
    }

    static ClientOverrideConfiguration overrideConfiguration(Duration apiCallTimeout) {
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(apiCallTimeout)
                .build();
    }

    public synchronized S3Client s3() {
        if (s3 == null) {
            s3 = S3Client.builder().overrideConfiguration(overrides).build();
            log.debug("Created S3 client");
        }
        return s3;
    }

    public synchronized SsmClient ssm() {
        if (ssm == null) {
            ssm = SsmClient.builder().overrideConfiguration(overrides).build();
            log.debug("Created SSM client");
        }
        return ssm;
    }

    public synchronized SecretsManagerClient secretsManager() {
        if (secretsManager == null) {
            secretsManager = SecretsManagerClient.builder().overrideConfiguration(overrides).build();
            log.debug("Created Secrets Manager client");
        }
        return secretsManager;
    }

    ClientOverrideConfiguration getOverrides() {
        return overrides;
    }

    @Override
    public synchronized void close() {
        if (s3 != null) {
            s3.close();
            s3 = null;
        }
        if (ssm != null) {
            ssm.close();
            ssm = null;
        }
        if (secretsManager != null) {
            secretsManager.close();
            secretsManager = null;
        }
    }
}

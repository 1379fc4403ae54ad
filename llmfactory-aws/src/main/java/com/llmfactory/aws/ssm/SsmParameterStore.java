package com.llmfactory.aws.ssm;

import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.ParameterStore;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.SsmException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ParameterStore} backed by AWS Systems Manager Parameter Store.
 * SecureString parameters are decrypted.
 */
@Slf4j
public class SsmParameterStore implements ParameterStore {

    private final Supplier<SsmClient> ssm;

    public SsmParameterStore(Supplier<SsmClient> ssm) {
        this.ssm = ssm;
    }

    @Override
    public Optional<String> getParameter(String name) {
        try {
            GetParameterResponse response = ssm.get().getParameter(GetParameterRequest.builder()
                    .name(name)
                    .withDecryption(true)
                    .build());
            if (response == null || response.parameter() == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(response.parameter().value());
        } catch (ParameterNotFoundException e) {
            log.debug("SSM parameter {} not found", name);
            return Optional.empty();
        } catch (SsmException | SdkClientException e) {
            throw new StoreAccessError("Failed to load parameter '" + name + "' from SSM: " + e.getMessage(), e);
        }
    }
}

package com.kmg.extract.config;

import com.kmg.extract.service.CredentialPool;
import com.kmg.extract.service.CredentialSourceService;
import com.kmg.extract.service.InferenceClient;
import com.kmg.extract.service.PromptFactory;
import com.kmg.extract.service.RequestDispatcher;
import com.kmg.extract.service.ResponseParser;
import com.kmg.extract.service.RetryPolicy;
import com.kmg.extract.service.TextSource;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExtractorConfiguration {

    @Bean
    public CredentialPool credentialPool(CredentialSourceService credentialSourceService, ExtractorProperties properties) {
        ExtractorProperties.Credentials credentials = properties.getCredentials();
        return new CredentialPool(
                credentialSourceService.loadSecrets(),
                credentials.getCooldown(),
                credentials.getTransientFailureThreshold(),
                System::nanoTime
        );
    }

    @Bean
    public RetryPolicy retryPolicy(ExtractorProperties properties) {
        ExtractorProperties.Dispatch dispatch = properties.getDispatch();
        return new RetryPolicy(
                dispatch.getMaxAttempts(),
                dispatch.getRetryDelay(),
                dispatch.getBackoffMultiplier(),
                dispatch.getMaxDelay()
        );
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService inferenceCallExecutor(ExtractorProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("inference-call-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getDispatch().getCallThreads(), threadFactory);
    }

    @Bean
    public RequestDispatcher requestDispatcher(
            CredentialPool credentialPool,
            TextSource textSource,
            InferenceClient inferenceClient,
            PromptFactory promptFactory,
            ResponseParser responseParser,
            RetryPolicy retryPolicy,
            ExecutorService inferenceCallExecutor,
            ExtractorProperties properties
    ) {
        return new RequestDispatcher(
                credentialPool,
                textSource,
                inferenceClient,
                promptFactory,
                responseParser,
                retryPolicy,
                inferenceCallExecutor,
                properties.getDispatch().getRequestTimeout(),
                properties.getBatch().getMinTextLength()
        );
    }

    /**
     * Socket timeouts slightly above the per-attempt deadline so the dispatcher's deadline fires first.
     */
    @Bean
    public RestClientCustomizer inferenceTimeoutCustomizer(ExtractorProperties properties) {
        Duration timeout = properties.getDispatch().getRequestTimeout().plusSeconds(5);
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(Duration.ofSeconds(15))
                .withReadTimeout(timeout);
        return builder -> builder.requestFactory(ClientHttpRequestFactories.get(settings));
    }
}

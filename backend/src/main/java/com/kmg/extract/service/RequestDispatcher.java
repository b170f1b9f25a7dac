package com.kmg.extract.service;

import com.kmg.extract.model.CallOutcome;
import com.kmg.extract.model.ClassifiedError;
import com.kmg.extract.model.CredentialHandle;
import com.kmg.extract.model.DispatchResult;
import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import com.kmg.extract.model.InsurerProfile;
import com.kmg.extract.model.NoUsableCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one document through the inference service, rotating credentials on rate limits and
 * retrying recoverable failures under a {@link RetryPolicy}.
 * <p>
 * Only failures that belong to the item spend its attempt budget. Rate limits, exhausted quotas and
 * rejected keys move on to another credential until the pool runs dry. An interrupt ends the
 * dispatch without an outcome and without charging the credential in flight.
 */
public class RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final CredentialPool credentialPool;
    private final TextSource textSource;
    private final InferenceClient inferenceClient;
    private final PromptFactory promptFactory;
    private final ResponseParser responseParser;
    private final RetryPolicy retryPolicy;
    private final ExecutorService callExecutor;
    private final Duration requestTimeout;
    private final int minTextLength;

    public RequestDispatcher(
            CredentialPool credentialPool,
            TextSource textSource,
            InferenceClient inferenceClient,
            PromptFactory promptFactory,
            ResponseParser responseParser,
            RetryPolicy retryPolicy,
            ExecutorService callExecutor,
            Duration requestTimeout,
            int minTextLength
    ) {
        this.credentialPool = credentialPool;
        this.textSource = textSource;
        this.inferenceClient = inferenceClient;
        this.promptFactory = promptFactory;
        this.responseParser = responseParser;
        this.retryPolicy = retryPolicy;
        this.callExecutor = callExecutor;
        this.requestTimeout = requestTimeout;
        this.minTextLength = minTextLength;
    }

    public DispatchResult dispatch(String sourceRef, InsurerProfile profile) {
        String text;
        try {
            text = textSource.getText(sourceRef);
        } catch (ExtractionException e) {
            return DispatchResult.failure(e.toClassifiedError(), 0, null);
        }
        if (text == null || text.strip().length() < minTextLength) {
            return DispatchResult.failure(new ClassifiedError(
                    ErrorKind.UNREADABLE,
                    "Extracted text is too short (" + (text == null ? 0 : text.strip().length()) + " chars)"
            ), 0, null);
        }

        String prompt = promptFactory.create(text, profile);
        ClassifiedError lastError = null;
        String lastCredentialId = null;
        int attempts = 0;
        int charged = 0;
        int swaps = 0;

        while (retryPolicy.hasAttemptsLeft(charged)) {
            if (Thread.currentThread().isInterrupted()
                    || (lastError != null && !pause(retryPolicy.delayBefore(charged + 1, lastError.kind())))) {
                return DispatchResult.interrupted(attempts, lastCredentialId);
            }

            CredentialHandle credential;
            try {
                credential = credentialPool.acquire();
            } catch (NoUsableCredentialException e) {
                return DispatchResult.failure(e.toClassifiedError(), attempts, lastCredentialId);
            }
            attempts++;
            lastCredentialId = credential.id();

            String raw;
            try {
                raw = callWithDeadline(prompt, credential);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Dispatch of {} interrupted while {} was in flight", sourceRef, credential.id());
                return DispatchResult.interrupted(attempts, lastCredentialId);
            } catch (ExtractionException e) {
                credentialPool.report(credential, CallOutcome.fromErrorKind(e.kind()));
                lastError = e.toClassifiedError();
                if (!retryPolicy.isRetryable(e.kind())) {
                    return DispatchResult.failure(lastError, attempts, lastCredentialId);
                }
                if (retryPolicy.isCredentialSwap(e.kind())) {
                    // Cooldowns may elapse between swaps, so the pool alone does not bound them.
                    if (++swaps > credentialPool.size()) {
                        return DispatchResult.failure(new ClassifiedError(ErrorKind.NO_USABLE_CREDENTIAL,
                                "No credential accepted the request after " + swaps + " swaps: " + e.getMessage()),
                                attempts, lastCredentialId);
                    }
                    log.info("Credential {} unavailable for {} ({}); swapping", credential.id(), sourceRef, e.kind());
                    continue;
                }
                charged++;
                log.info("Attempt {}/{} for {} via {} failed ({}): {}",
                        charged, retryPolicy.maxAttempts(), sourceRef, credential.id(), e.kind(), e.getMessage());
                continue;
            }

            credentialPool.report(credential, CallOutcome.SUCCESS);
            try {
                Map<String, String> payload = responseParser.parse(raw, profile);
                return DispatchResult.success(payload, attempts, lastCredentialId);
            } catch (ExtractionException e) {
                lastError = e.toClassifiedError();
                charged++;
                log.info("Attempt {}/{} for {} returned an unusable response: {}",
                        charged, retryPolicy.maxAttempts(), sourceRef, e.getMessage());
            }
        }

        return DispatchResult.failure(lastError, attempts, lastCredentialId);
    }

    private String callWithDeadline(String prompt, CredentialHandle credential) throws InterruptedException {
        Future<String> future = callExecutor.submit(() -> inferenceClient.infer(prompt, credential));
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE,
                    "Inference call timed out after " + requestTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extraction) {
                throw extraction;
            }
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE,
                    "Inference call failed: " + (cause == null ? e.getMessage() : cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

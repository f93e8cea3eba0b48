package com.baykanat.attribution.proxy.credentials;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.IdToken;
import com.google.auth.oauth2.IdTokenCredentials;
import com.google.auth.oauth2.IdTokenProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application-default credentials (servis hesabı, metadata server) ile audience'a özel
 * Google ID token basar. Her basım mintTimeout ile sınırlıdır.
 */
@Slf4j
public class GoogleIdTokenSource implements IdTokenSource, AutoCloseable {

    /** Token süre bilgisi taşımıyorsa varsayılan ömür. */
    private static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(5);

    private final Duration mintTimeout;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "id-token-mint");
        thread.setDaemon(true);
        return thread;
    });

    private GoogleCredentials credentials;

    public GoogleIdTokenSource(Duration mintTimeout) {
        this.mintTimeout = mintTimeout;
    }

    @Override
    public MintedToken mint(String audience) {
        Future<MintedToken> future = executor.submit(() -> mintNow(audience));
        try {
            return future.get(mintTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CredentialMintingException("Identity token minting timed out after " + mintTimeout, e);
        } catch (ExecutionException e) {
            throw new CredentialMintingException("Identity token minting failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialMintingException("Interrupted while minting identity token", e);
        }
    }

    private MintedToken mintNow(String audience) throws IOException {
        GoogleCredentials source = applicationDefault();
        if (!(source instanceof IdTokenProvider)) {
            throw new IOException("Credentials of type " + source.getClass().getSimpleName()
                    + " cannot mint identity tokens");
        }

        IdTokenCredentials idTokenCredentials = IdTokenCredentials.newBuilder()
                .setIdTokenProvider((IdTokenProvider) source)
                .setTargetAudience(audience)
                .setOptions(List.of(IdTokenProvider.Option.FORMAT_FULL))
                .build();
        idTokenCredentials.refresh();

        IdToken idToken = idTokenCredentials.getIdToken();
        Instant expiresAt = idToken.getExpirationTime() != null
                ? idToken.getExpirationTime().toInstant()
                : Instant.now().plus(DEFAULT_LIFETIME);
        return new MintedToken(idToken.getTokenValue(), expiresAt);
    }

    /** İlk basımda yüklenir; uygulama credential'sız ortamda da açılabilir. */
    private synchronized GoogleCredentials applicationDefault() throws IOException {
        if (credentials == null) {
            credentials = GoogleCredentials.getApplicationDefault();
            log.info("Loaded application default credentials: {}", credentials.getClass().getSimpleName());
        }
        return credentials;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

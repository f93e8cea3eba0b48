package com.baykanat.attribution.proxy.credentials;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audience başına son token'ı tutar, son kullanma zamanına skew kadar kala yeniden basar.
 * Yalnızca optimizasyon: cache boşken davranış aynıdır.
 */
@Slf4j
public class CachingIdTokenSource implements IdTokenSource {

    private final IdTokenSource delegate;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Map<String, MintedToken> tokens = new ConcurrentHashMap<>();

    public CachingIdTokenSource(IdTokenSource delegate, Clock clock, Duration refreshSkew) {
        this.delegate = delegate;
        this.clock = clock;
        this.refreshSkew = refreshSkew;
    }

    @Override
    public MintedToken mint(String audience) {
        MintedToken cached = tokens.get(audience);
        if (cached != null && cached.isUsableAt(clock.instant(), refreshSkew)) {
            return cached;
        }

        MintedToken fresh = delegate.mint(audience);
        tokens.put(audience, fresh);
        log.debug("Minted identity token for audience {}, expires at {}", audience, fresh.getExpiresAt());
        return fresh;
    }
}

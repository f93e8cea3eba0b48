package com.baykanat.attribution.proxy.credentials;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/** Üretilmiş token ve son kullanma zamanı. */
@Data
@AllArgsConstructor
public class MintedToken {

    @ToString.Exclude
    private String tokenValue;
    private Instant expiresAt;

    /** now + skew anında hâlâ geçerli mi. */
    public boolean isUsableAt(Instant now, Duration skew) {
        return expiresAt != null && now.plus(skew).isBefore(expiresAt);
    }
}

package com.baykanat.attribution.proxy.credentials;

/** Kimlik token'ı üretilemedi; istek hiç iletilmeden 503 döner. */
public class CredentialMintingException extends RuntimeException {

    public CredentialMintingException(String message) {
        super(message);
    }

    public CredentialMintingException(String message, Throwable cause) {
        super(message, cause);
    }
}

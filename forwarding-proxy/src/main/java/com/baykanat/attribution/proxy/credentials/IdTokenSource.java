package com.baykanat.attribution.proxy.credentials;

/** Belirli bir audience için kimlik token'ı üretir. */
public interface IdTokenSource {

    /**
     * @param audience token'ın geçerli olacağı hedef (ör. ingestion API URL'i)
     * @throws CredentialMintingException token üretilemezse ya da süre aşılırsa
     */
    MintedToken mint(String audience);
}

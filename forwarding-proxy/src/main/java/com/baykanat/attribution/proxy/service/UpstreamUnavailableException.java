package com.baykanat.attribution.proxy.service;

/** Ingestion API'ye ulaşılamadı ya da zaman aşımı; 502. */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.baykanat.attribution.proxy.service;

/** Çağıranın anahtarı eksik/yanlış; 401, hiçbir şey iletilmez. */
public class AuthRejectedException extends RuntimeException {

    public AuthRejectedException(String message) {
        super(message);
    }
}

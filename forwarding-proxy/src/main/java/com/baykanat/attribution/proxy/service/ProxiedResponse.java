package com.baykanat.attribution.proxy.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;

/** Upstream'den alınan, çağırana aynen dönülecek cevap. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxiedResponse {

    private int status;
    private HttpHeaders headers;
    private byte[] body;
}

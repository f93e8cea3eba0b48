package com.baykanat.attribution.proxy.api.controller;

import com.baykanat.attribution.proxy.service.ForwardingService;
import com.baykanat.attribution.proxy.service.ProxiedResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/** Her path ve method için tek giriş noktası; istek ingestion API'ye aynen iletilir. */
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private final ForwardingService forwardingService;

    /** Gövde ham stream'den okunur; form gövdeleri parametrelerden yeniden kurulmaz. */
    @RequestMapping("/**")
    public ResponseEntity<byte[]> forward(HttpServletRequest request) throws IOException {
        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
        ProxiedResponse response = forwardingService.forward(request, body);
        return ResponseEntity.status(response.getStatus())
                .headers(response.getHeaders())
                .body(response.getBody());
    }
}

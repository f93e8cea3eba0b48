package com.baykanat.attribution.proxy.http;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/** Giden istek/gelen cevabı DEBUG'da loglar; Authorization ve secret header'ı maskelenir. */
@Slf4j
public class LoggingInterceptor implements Interceptor {

    private static final String REDACTED = "<redacted>";

    private final Set<String> sensitiveHeaders;

    public LoggingInterceptor(String sharedSecretHeader) {
        this.sensitiveHeaders = Set.of("authorization", sharedSecretHeader.toLowerCase(Locale.ROOT));
    }

    @NotNull
    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();

        long startTime = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("Forwarding {} {}\nHeaders:\n{}", request.method(), request.url(), redact(request.headers()));
        }

        Response response = chain.proceed(request);

        long endTime = System.nanoTime();
        log.debug("Upstream answered {} {} with {} in {} ms", request.method(), request.url().encodedPath(),
                response.code(), String.format("%.1f", (endTime - startTime) / 1e6d));
        return response;
    }

    String redact(Headers headers) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < headers.size(); i++) {
            String name = headers.name(i);
            String value = sensitiveHeaders.contains(name.toLowerCase(Locale.ROOT)) ? REDACTED : headers.value(i);
            out.append(name).append(": ").append(value).append('\n');
        }
        return out.toString();
    }
}

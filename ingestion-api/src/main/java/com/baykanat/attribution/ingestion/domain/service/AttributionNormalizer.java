package com.baykanat.attribution.ingestion.domain.service;

import com.baykanat.attribution.ingestion.domain.exception.InvalidPayloadException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;

/** Click attribution alanları: tarih parse, content'ten platform tag'i, click id. */
@Service
public class AttributionNormalizer {

    static final String INSTAGRAM = "instagram";
    static final String FACEBOOK = "facebook";

    /** Sırayla denenir: tarih, offset'li tarih-saat, offset'siz tarih-saat. */
    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            LocalDate::parse,
            value -> OffsetDateTime.parse(value).toLocalDate(),
            value -> LocalDateTime.parse(value).toLocalDate()
    );

    /** YYYY-MM-DD ya da ISO-8601 date-time kabul eder; boşsa clickedAt'in UTC günü. */
    public LocalDate parseEventDate(String raw, Instant clickedAt) {
        if (raw == null || raw.isBlank()) {
            return clickedAt.atOffset(ZoneOffset.UTC).toLocalDate();
        }
        String value = raw.trim();
        DateTimeParseException lastFailure = null;
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new InvalidPayloadException("date",
                "date must be YYYY-MM-DD or an ISO-8601 date-time, got '" + value + "' ("
                        + lastFailure.getMessage() + ")");
    }

    /** content içinde instagram/facebook geçiyorsa ilgili tag, yoksa null. */
    public String deriveTag(String content) {
        if (content == null) {
            return null;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.contains(INSTAGRAM)) {
            return INSTAGRAM;
        }
        if (lower.contains(FACEBOOK)) {
            return FACEBOOK;
        }
        return null;
    }

    /** İstemci id'si varsa o, yoksa yeni clk- id. Edge'ler append-only; id benzersizlik anahtarı değil. */
    public String resolveClickId(String rawId) {
        if (rawId != null && !rawId.isBlank()) {
            return rawId.trim();
        }
        return "clk-" + UUID.randomUUID();
    }

    /** Boş string'leri null'a çevirir. */
    public String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

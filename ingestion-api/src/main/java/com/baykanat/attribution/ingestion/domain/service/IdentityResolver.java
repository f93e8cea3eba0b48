package com.baykanat.attribution.ingestion.domain.service;

import com.baykanat.attribution.ingestion.api.dto.CampaignRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonRequest;
import com.baykanat.attribution.ingestion.domain.model.AdCampaign;
import com.baykanat.attribution.ingestion.domain.model.Person;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

/**
 * Eksik/boş alanları fallback politikasıyla doldurur ve id'siz node'lar için id üretir.
 *
 * <p>Üretilen id: {@code <prefix>-} + SHA-256(hex) over trim + lowercase(ROOT) normalize edilmiş
 * id dışı alanlar; her alan {@code <utf8 byte uzunluğu>:<değer>;} olarak sabit sırayla kodlanır.
 * Hiç alan yoksa {@code <prefix>-<uuid>} (her seferinde yeni node).
 */
@Slf4j
@Service
public class IdentityResolver {

    public static final String UNKNOWN = "Unknown";
    public static final String PERSON_PREFIX = "person";
    public static final String CAMPAIGN_PREFIX = "campaign";

    /** name, email, contact_number için fallback; id yoksa bu üç alandan türetilir. */
    public Person resolvePerson(PersonRequest request) {
        String id = idOrGenerated(request.getId(), PERSON_PREFIX,
                request.getName(), request.getEmail(), request.getContactNumber());

        return Person.builder()
                .id(id)
                .name(displayOrUnknown(request.getName()))
                .email(displayOrUnknown(request.getEmail()))
                .contactNumber(displayOrUnknown(request.getContactNumber()))
                .build();
    }

    /** campaign için fallback; id yoksa campaign adından türetilir. */
    public AdCampaign resolveCampaign(CampaignRequest request) {
        String id = idOrGenerated(request.getId(), CAMPAIGN_PREFIX, request.getCampaign());

        return AdCampaign.builder()
                .id(id)
                .campaign(displayOrUnknown(request.getCampaign()))
                .build();
    }

    /** Click'in referans verdiği uç id'si; türetilecek alan olmadığından boşsa yeni id. */
    public String resolveReferencedId(String rawId, String prefix) {
        return idOrGenerated(rawId, prefix);
    }

    /** Verilen alanlardan deterministik id; hepsi boşsa rastgele. */
    public String generateId(String prefix, String... fields) {
        boolean anyPresent = false;
        for (String field : fields) {
            if (field != null && !field.isBlank()) {
                anyPresent = true;
                break;
            }
        }
        if (!anyPresent) {
            String fresh = prefix + "-" + UUID.randomUUID();
            log.debug("No identifying fields supplied, minted fresh id {}", fresh);
            return fresh;
        }
        return prefix + "-" + sha256(canonicalForm(fields));
    }

    /** Hash girdisi; alan sınırları uzunluk önekiyle belirlenir. */
    String canonicalForm(String... fields) {
        StringBuilder canonical = new StringBuilder();
        for (String field : fields) {
            String normalized = field == null ? "" : field.trim().toLowerCase(Locale.ROOT);
            canonical.append(normalized.getBytes(StandardCharsets.UTF_8).length)
                    .append(':')
                    .append(normalized)
                    .append(';');
        }
        return canonical.toString();
    }

    private String idOrGenerated(String rawId, String prefix, String... derivationFields) {
        if (rawId != null && !rawId.isBlank()) {
            return rawId.trim();
        }
        return generateId(prefix, derivationFields);
    }

    private static String displayOrUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.trim();
    }

    /** Girdi string'in SHA-256 hash'ini hesaplar. */
    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}

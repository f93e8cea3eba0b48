package com.baykanat.attribution.ingestion.infrastructure.persistence;

import com.baykanat.attribution.ingestion.domain.model.AdCampaign;
import com.baykanat.attribution.ingestion.domain.model.UpsertOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Objects;

/** ad_campaign node tablosu; person ile aynı ON CONFLICT semantiği. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CampaignJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String UPSERT_SQL = """
            INSERT INTO ad_campaign (id, campaign)
            VALUES (?, ?)
            ON CONFLICT (id) DO UPDATE
               SET campaign = EXCLUDED.campaign,
                   updated_at = NOW()
            RETURNING internal_id, id, campaign, (xmax = 0) AS inserted
            """;

    private static final String PLACEHOLDER_SQL = """
            INSERT INTO ad_campaign (id, campaign)
            VALUES (?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

    /** Node'u id üzerinden oluşturur ya da günceller; son hali döner. */
    public UpsertOutcome<AdCampaign> upsert(AdCampaign campaign) {
        return jdbcTemplate.queryForObject(UPSERT_SQL, (rs, rowNum) -> new UpsertOutcome<>(
                AdCampaign.builder()
                        .internalId(rs.getLong("internal_id"))
                        .id(rs.getString("id"))
                        .campaign(rs.getString("campaign"))
                        .build(),
                rs.getBoolean("inserted")
        ), campaign.getId(), campaign.getCampaign());
    }

    /** Yoksa placeholder node ekler, varsa dokunmaz. Ekleme olduysa true. */
    public boolean insertPlaceholderIfAbsent(String id, String placeholderValue) {
        int inserted = jdbcTemplate.update(PLACEHOLDER_SQL, Objects.requireNonNull(id, "id"), placeholderValue);
        return inserted > 0;
    }
}

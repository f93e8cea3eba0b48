package com.baykanat.attribution.ingestion.infrastructure.persistence;

import com.baykanat.attribution.ingestion.domain.model.ClickEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** clicked_on edge tablosu: append-only insert ve uç node özetleriyle okuma. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ClickJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO clicked_on (click_id, person_id, campaign_id, content, source, medium, term, tag, device,
                                    event_date, attributes, clicked_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            RETURNING edge_id
            """;

    private static final String SELECT_SQL = """
            SELECT r.edge_id, r.click_id, r.person_id, p.name AS person_name,
                   r.campaign_id, c.campaign AS campaign_name,
                   r.content, r.source, r.medium, r.term, r.tag, r.device,
                   r.event_date, r.attributes::text AS attributes, r.clicked_at
            FROM clicked_on r
            JOIN person p ON p.id = r.person_id
            JOIN ad_campaign c ON c.id = r.campaign_id
            """;

    private static final RowMapper<ClickEvent> ROW_MAPPER = (rs, rowNum) -> {
        Date eventDate = rs.getDate("event_date");
        Timestamp clickedAt = Objects.requireNonNull(rs.getTimestamp("clicked_at"), "clicked_at");
        return ClickEvent.builder()
                .edgeId(rs.getLong("edge_id"))
                .clickId(rs.getString("click_id"))
                .personId(rs.getString("person_id"))
                .personName(rs.getString("person_name"))
                .campaignId(rs.getString("campaign_id"))
                .campaignName(rs.getString("campaign_name"))
                .content(rs.getString("content"))
                .source(rs.getString("source"))
                .medium(rs.getString("medium"))
                .term(rs.getString("term"))
                .tag(rs.getString("tag"))
                .device(rs.getString("device"))
                .eventDate(eventDate != null ? eventDate.toLocalDate() : null)
                .attributes(rs.getString("attributes"))
                .clickedAt(clickedAt.toInstant())
                .build();
    };

    /** Yeni edge ekler (önceki edge'lerle birleştirmez); edge_id döner. Uç node'lar FK ile zorunlu. */
    public long insert(ClickEvent click) {
        Long edgeId = jdbcTemplate.queryForObject(INSERT_SQL, Long.class,
                click.getClickId(),
                click.getPersonId(),
                click.getCampaignId(),
                click.getContent(),
                click.getSource(),
                click.getMedium(),
                click.getTerm(),
                click.getTag(),
                click.getDevice(),
                Date.valueOf(Objects.requireNonNull(click.getEventDate(), "eventDate")),
                new SqlParameterValue(Types.OTHER, click.getAttributes()),
                Timestamp.from(Objects.requireNonNull(click.getClickedAt(), "clickedAt")));
        return Objects.requireNonNull(edgeId, "edge_id");
    }

    public Optional<ClickEvent> findByEdgeId(long edgeId) {
        List<ClickEvent> rows = jdbcTemplate.query(SELECT_SQL + " WHERE r.edge_id = ?", ROW_MAPPER, edgeId);
        return rows.stream().findFirst();
    }

    /** En yeni N edge; clicked_at DESC, eşitlikte edge_id DESC. */
    public List<ClickEvent> findRecent(int limit) {
        return jdbcTemplate.query(SELECT_SQL + " ORDER BY r.clicked_at DESC, r.edge_id DESC LIMIT ?",
                ROW_MAPPER, limit);
    }
}

package com.baykanat.attribution.ingestion.infrastructure.persistence;

import com.baykanat.attribution.ingestion.domain.model.Person;
import com.baykanat.attribution.ingestion.domain.model.PersonIdentity;
import com.baykanat.attribution.ingestion.domain.model.UpsertOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;

/** person node tablosu. Yazımlar tek ifadelik INSERT ... ON CONFLICT; read-then-write yok. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PersonJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String UPSERT_SQL = """
            INSERT INTO person (id, name, email, contact_number)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE
               SET name = EXCLUDED.name,
                   email = EXCLUDED.email,
                   contact_number = EXCLUDED.contact_number,
                   updated_at = NOW()
            RETURNING internal_id, id, name, email, contact_number, (xmax = 0) AS inserted
            """;

    private static final String PLACEHOLDER_SQL = """
            INSERT INTO person (id, name, email, contact_number)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

    /** Node'u id üzerinden oluşturur ya da tüm alanlarını günceller; son hali döner. */
    public UpsertOutcome<Person> upsert(Person person) {
        return jdbcTemplate.queryForObject(UPSERT_SQL, (rs, rowNum) -> new UpsertOutcome<>(
                Person.builder()
                        .internalId(rs.getLong("internal_id"))
                        .id(rs.getString("id"))
                        .name(rs.getString("name"))
                        .email(rs.getString("email"))
                        .contactNumber(rs.getString("contact_number"))
                        .build(),
                rs.getBoolean("inserted")
        ), person.getId(), person.getName(), person.getEmail(), person.getContactNumber());
    }

    /** Yoksa placeholder node ekler, varsa dokunmaz. Ekleme olduysa true. */
    public boolean insertPlaceholderIfAbsent(String id, String placeholderValue) {
        int inserted = jdbcTemplate.update(PLACEHOLDER_SQL,
                Objects.requireNonNull(id, "id"), placeholderValue, placeholderValue, placeholderValue);
        return inserted > 0;
    }

    /** internal id'ler (artan); onlyConnected ise en az bir Clicked_on edge'i olanlar. */
    public List<Long> findInternalIds(boolean onlyConnected, int skip, int limit) {
        StringBuilder sql = new StringBuilder("SELECT p.internal_id FROM person p");
        if (onlyConnected) {
            sql.append(" WHERE EXISTS (SELECT 1 FROM clicked_on r WHERE r.person_id = p.id)");
        }
        sql.append(" ORDER BY p.internal_id OFFSET ? LIMIT ?");

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.queryForList(sqlStr, Long.class, skip, limit);
    }

    /** Dış id → internal id çiftleri, dış id'ye göre sıralı. */
    public List<PersonIdentity> findIdentities(int skip, int limit) {
        String sql = "SELECT id, internal_id FROM person ORDER BY id OFFSET ? LIMIT ?";
        return jdbcTemplate.query(sql, (rs, rowNum) -> new PersonIdentity(
                rs.getString("id"),
                rs.getLong("internal_id")
        ), skip, limit);
    }
}

package com.bookshelf.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.bookshelf.backend.modules.authorization.domain.SystemActor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Inserts the system actor row on startup when it is missing. An existing row
 * is left untouched, including its password.
 */
@Component
public class SystemActorSeeder {

    private static final Logger log = LoggerFactory.getLogger(SystemActorSeeder.class);

    private static final String INSERT_SQL = """
            INSERT INTO app_user (id, name, email, password_hash, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final String name;
    private final String email;
    private final String password;

    public SystemActorSeeder(
            JdbcTemplate jdbcTemplate,
            PasswordEncoder passwordEncoder,
            Clock clock,
            @Value("${app.system-actor.name:System Administrator}") String name,
            @Value("${app.system-actor.email:system@example.com}") String email,
            @Value("${app.system-actor.password}") String password
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.name = name;
        this.email = email;
        this.password = password;
    }

    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int inserted = jdbcTemplate.update(INSERT_SQL,
                SystemActor.ID, name, email, passwordEncoder.encode(password), now, now);
        if (inserted > 0) {
            log.info("Seeded system actor id={} email={}", SystemActor.ID, email);
            return;
        }
        Integer present = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM app_user WHERE id = ?", Integer.class, SystemActor.ID);
        if (present == null || present == 0) {
            log.warn("System actor row could not be inserted; email {} is already used by another account", email);
        }
    }
}

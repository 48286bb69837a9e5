package com.flagship.transfer_engine.account;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * JDBC access to the accounts table.
 *
 * Balances are only ever changed through {@link #debit} and {@link #credit},
 * which are single UPDATE statements so the row lock is taken by the store.
 * The CHECK (balance >= 0) constraint is the last line of defence.
 */
@Repository
public class AccountRepository {

    private static final String ACCOUNT_COLUMNS =
            "id, account_number, account_name, balance, minimum_balance, is_active, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(UUID id, String accountNumber, String accountName,
                       BigDecimal balance, BigDecimal minimumBalance) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, account_name, balance, minimum_balance, is_active) " +
            "VALUES (?, ?, ?, ?, ?, TRUE)",
            id, accountNumber, accountName, balance, minimumBalance
        );
    }

    public Optional<Account> findById(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    public Optional<Account> findActiveById(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? AND is_active = TRUE",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    /**
     * Reads an active account and locks its row until the surrounding transaction ends.
     * Concurrent debits of the same account therefore never observe a stale balance.
     */
    public Optional<Account> findActiveByIdForUpdate(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? AND is_active = TRUE FOR UPDATE",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    /**
     * Locks the given account rows in id order. Every transfer takes its two rows
     * this way before anything else, so opposite-direction transfers queue instead
     * of deadlocking.
     */
    public void lockInIdOrder(UUID first, UUID second) {
        List<UUID> ids = Stream.of(first, second)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
        if (ids.isEmpty()) {
            return;
        }
        jdbcTemplate.query(
            "SELECT id FROM accounts WHERE id IN (" + String.join(", ", Collections.nCopies(ids.size(), "?")) +
            ") ORDER BY id FOR UPDATE",
            (rs, rowNum) -> rs.getString("id"),
            ids.toArray()
        );
    }

    public List<Account> findAllActive() {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE is_active = TRUE ORDER BY account_name",
            accountRowMapper()
        );
    }

    /**
     * @return number of rows updated (0 when the account does not exist)
     */
    public int debit(UUID accountId, BigDecimal amount) {
        return jdbcTemplate.update(
            "UPDATE accounts SET balance = balance - ? WHERE id = ?",
            amount, accountId
        );
    }

    /**
     * @return number of rows updated (0 when the account does not exist)
     */
    public int credit(UUID accountId, BigDecimal amount) {
        return jdbcTemplate.update(
            "UPDATE accounts SET balance = balance + ? WHERE id = ?",
            amount, accountId
        );
    }

    public void deactivate(UUID accountId) {
        jdbcTemplate.update("UPDATE accounts SET is_active = FALSE WHERE id = ?", accountId);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("account_number"),
            rs.getString("account_name"),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("minimum_balance"),
            rs.getBoolean("is_active"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

package com.ledger.core.identifier;

import com.ledger.core.model.Venue;

import java.util.Objects;

/**
 * Account identity in the {@code ISSUER-IDENTIFIER-TYPE} form, e.g. {@code FXCM-01234-SIMULATED}.
 * The issuer names the venue the account trades on.
 */
public record AccountId(String issuer, String identifier, AccountType type) {
    public AccountId {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(type, "type");
        if (issuer.isBlank() || identifier.isBlank()) {
            throw new IllegalArgumentException("AccountId contains blank values");
        }
        issuer = issuer.trim().toUpperCase();
        identifier = identifier.trim();
    }

    public static AccountId parse(String value) {
        Objects.requireNonNull(value, "value");
        int first = value.indexOf('-');
        int last = value.lastIndexOf('-');
        if (first <= 0 || last == first || last == value.length() - 1) {
            throw new IllegalArgumentException("AccountId must be ISSUER-IDENTIFIER-TYPE: " + value);
        }
        AccountType type;
        try {
            type = AccountType.valueOf(value.substring(last + 1).trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown account type in AccountId: " + value, e);
        }
        return new AccountId(value.substring(0, first), value.substring(first + 1, last), type);
    }

    public Venue venue() {
        return new Venue(issuer);
    }

    @Override
    public String toString() {
        return issuer + "-" + identifier + "-" + type.name();
    }
}

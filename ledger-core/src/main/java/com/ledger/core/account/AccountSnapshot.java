package com.ledger.core.account;

import com.ledger.core.event.AccountState;
import com.ledger.core.identifier.AccountId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Money;
import com.ledger.core.model.Venue;

import java.util.Objects;

/**
 * Immutable account view taken at one point in time. Every figure comes from the
 * same {@link AccountState}, so balance, free and locked always agree.
 */
public record AccountSnapshot(AccountState state, int stateCount) implements AccountFacade {

    public AccountSnapshot {
        Objects.requireNonNull(state, "state");
        if (stateCount < 1) {
            throw new IllegalArgumentException("stateCount must be positive: " + stateCount);
        }
    }

    @Override
    public AccountId id() {
        return state.accountId();
    }

    @Override
    public Venue venue() {
        return state.accountId().venue();
    }

    @Override
    public Currency currency() {
        return state.currency();
    }

    @Override
    public Money balance() {
        return state.balance();
    }

    @Override
    public Money freeBalance() {
        return state.marginAvailable();
    }

    @Override
    public Money lockedBalance() {
        return state.marginUsed();
    }

    @Override
    public Money orderMargin() {
        return state.orderMargin();
    }

    @Override
    public Money positionMargin() {
        return state.marginUsed().subtract(state.orderMargin());
    }

    @Override
    public AccountState lastState() {
        return state;
    }
}

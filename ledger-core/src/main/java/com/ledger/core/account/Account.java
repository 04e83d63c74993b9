package com.ledger.core.account;

import com.ledger.core.event.AccountState;
import com.ledger.core.identifier.AccountId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Money;
import com.ledger.core.model.Venue;

import java.util.Objects;

/**
 * Balance ledger for one account on one venue.
 *
 * Balances are never derived from fills here: every {@link AccountState} replaces the
 * snapshot wholesale, since the upstream ledger is authoritative.
 *
 * Not thread-safe. The portfolio keeps its own copy and only hands out
 * {@link AccountSnapshot}s.
 */
public final class Account implements AccountFacade {

    private final AccountId id;
    private final Currency currency;
    private AccountState state;
    private int stateCount;

    public Account(AccountState initial) {
        Objects.requireNonNull(initial, "initial");
        this.id = initial.accountId();
        this.currency = initial.currency();
        this.state = initial;
        this.stateCount = 1;
    }

    private Account(Account other) {
        this.id = other.id;
        this.currency = other.currency;
        this.state = other.state;
        this.stateCount = other.stateCount;
    }

    /** Independent ledger with the same state; later changes to either do not reach the other. */
    public Account copy() {
        return new Account(this);
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(state, stateCount);
    }

    /**
     * @throws IllegalArgumentException if the state belongs to another account or currency
     */
    public void applyState(AccountState next) {
        Objects.requireNonNull(next, "next");
        if (!next.accountId().equals(id)) {
            throw new IllegalArgumentException("AccountState for " + next.accountId() + " applied to account " + id);
        }
        if (!next.currency().equals(currency)) {
            throw new IllegalArgumentException(
                "AccountState currency " + next.currency() + " does not match account currency " + currency);
        }
        this.state = next;
        this.stateCount++;
    }

    @Override
    public AccountId id() {
        return id;
    }

    @Override
    public Venue venue() {
        return id.venue();
    }

    @Override
    public Currency currency() {
        return currency;
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

    @Override
    public int stateCount() {
        return stateCount;
    }

    @Override
    public String toString() {
        return "Account(" + id + ", balance=" + balance() + ")";
    }
}

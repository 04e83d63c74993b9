package com.ledger.core.account;

import com.ledger.core.event.AccountState;
import com.ledger.core.identifier.AccountId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Money;
import com.ledger.core.model.Venue;

/**
 * Read-only view of an account. The portfolio hands out {@link AccountSnapshot}s,
 * which keep showing the state they were taken from.
 */
public interface AccountFacade {

    AccountId id();

    Venue venue();

    /** Base currency all balances and valuations of this account are expressed in. */
    Currency currency();

    Money balance();

    Money freeBalance();

    Money lockedBalance();

    Money orderMargin();

    Money positionMargin();

    AccountState lastState();

    /** Number of account states applied so far, the initial one included. */
    int stateCount();
}

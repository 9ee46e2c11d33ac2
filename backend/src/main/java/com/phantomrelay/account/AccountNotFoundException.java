package com.phantomrelay.account;

import com.phantomrelay.protocol.RelayException;

public class AccountNotFoundException extends RelayException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("User not found");
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}

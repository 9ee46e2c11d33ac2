package com.phantomrelay.account;

/**
 * Outcome of one registration.
 *
 * @param onlineUsers distinct known account ids, not only those currently connected
 * @param created     whether this registration created the account
 * @param flushed     queued messages handed to the new connection
 */
public record RegistrationResult(String accountId, int onlineUsers, boolean created, int flushed) {}

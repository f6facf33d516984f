package io.b2mash.b2b.backofficeaudit.context;

/** Authenticated back-office principal bound to the current operation. */
public record CurrentIdentity(int userId) {}

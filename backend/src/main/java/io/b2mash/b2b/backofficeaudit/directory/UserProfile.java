package io.b2mash.b2b.backofficeaudit.directory;

/** Back-office user as seen by the audit trail. {@code email} may be blank. */
public record UserProfile(int id, String name, String email) {}

package io.b2mash.b2b.backofficeaudit.directory;

/** Site member as seen by the audit trail. {@code email} may be blank. */
public record MemberProfile(int id, String name, String email) {}

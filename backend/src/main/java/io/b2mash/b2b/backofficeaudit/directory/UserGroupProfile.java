package io.b2mash.b2b.backofficeaudit.directory;

public record UserGroupProfile(int id, String name, String alias) {}

package io.b2mash.b2b.backofficeaudit.directory;

public record ContentEntitySummary(int id, String name) {}

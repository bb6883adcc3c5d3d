package io.intellixity.relq.sql.compile;

/**
 * How rows of a relation query are tied back to their owners.
 *
 * @param keyColumn     qualified SQL expression holding the owner key on each result row
 * @param ownerKeyField owner entity field whose values are matched against {@code keyColumn}
 */
public record Correlation(String keyColumn, String ownerKeyField) {}

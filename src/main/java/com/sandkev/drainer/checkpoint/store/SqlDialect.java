package com.sandkev.drainer.checkpoint.store;

/** Statements for the checkpoint table, one constant per supported backend. */
public enum SqlDialect {

    /** Column-oriented flash store behind the ClickHouse JDBC driver. */
    FLASH {
        @Override public String createSchema(String schema) {
            return "CREATE DATABASE IF NOT EXISTS `%s`".formatted(schema);
        }
        @Override public String createTable(String schema, String table) {
            return ("ATTACH TABLE IF NOT EXISTS `%s`.`%s`(`clusterid` UInt64, `checkpoint` String) "
                    + "ENGINE MutableMergeTree((`clusterid`), 8192)").formatted(schema, table);
        }
        @Override public String select(String schema, String table) {
            return "SELECT `checkpoint` FROM `%s`.`%s` WHERE `clusterid` = ?".formatted(schema, table);
        }
        @Override public String upsert(String schema, String table) {
            // append-only engine; reads see the latest version of the key
            return "IMPORT INTO `%s`.`%s` (`clusterid`, `checkpoint`) VALUES(?, ?)".formatted(schema, table);
        }
        @Override public String jdbcUrl(BackendAddress address) {
            return "jdbc:clickhouse://%s:%d/".formatted(address.host(), address.port());
        }
    },

    /** Local runs and tests. */
    H2 {
        @Override public String createSchema(String schema) {
            return "create schema if not exists \"%s\"".formatted(schema);
        }
        @Override public String createTable(String schema, String table) {
            return """
                create table if not exists "%s"."%s" (
                    "clusterid" bigint primary key,
                    "checkpoint" varchar not null
                )""".formatted(schema, table);
        }
        @Override public String select(String schema, String table) {
            return "select \"checkpoint\" from \"%s\".\"%s\" where \"clusterid\" = ?".formatted(schema, table);
        }
        @Override public String upsert(String schema, String table) {
            return """
                merge into "%s"."%s" ("clusterid", "checkpoint")
                key ("clusterid")
                values (?, ?)""".formatted(schema, table);
        }
        @Override public String jdbcUrl(BackendAddress address) {
            return "jdbc:h2:tcp://%s:%d/mem:drainer".formatted(address.host(), address.port());
        }
    };

    public abstract String createSchema(String schema);
    public abstract String createTable(String schema, String table);
    public abstract String select(String schema, String table);
    public abstract String upsert(String schema, String table);
    public abstract String jdbcUrl(BackendAddress address);
}

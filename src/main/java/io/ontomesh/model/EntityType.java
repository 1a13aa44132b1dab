package io.ontomesh.model;

import java.util.Locale;

public enum EntityType {
    GLOBAL,
    TABLE,
    COLUMN,
    TEST_JOIN;

    public String wire() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static EntityType fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public static String globalKey() {
        return "";
    }

    public static String tableKey(String tableName) {
        return tableName;
    }

    public static String columnKey(String tableName, String columnName) {
        return tableName + "." + columnName;
    }
}

package com.osman.picking.core.sheet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expected layout of one input table: logical fields with their type, whether they are mandatory and the
 * header names that may carry them.
 *
 * @param table    human-readable table name used in error messages
 * @param keyField logical field used to recognise the header row
 * @param fields   ordered field declarations
 */
public record ColumnSchema(String table, String keyField, List<Field> fields) {

    public ColumnSchema {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(keyField, "keyField");
        fields = List.copyOf(fields);
        Set<String> names = new LinkedHashSet<>();
        for (Field field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field '%s' in %s schema".formatted(field.name(), table));
            }
        }
        if (!names.contains(keyField)) {
            throw new IllegalArgumentException("Key field '%s' is not declared in %s schema".formatted(keyField, table));
        }
    }

    public Field field(String name) {
        return fields.stream()
            .filter(field -> field.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    public Field key() {
        return field(keyField);
    }

    /**
     * Returns a copy of this schema with the given field replaced or appended.
     */
    public ColumnSchema with(Field replacement) {
        List<Field> updated = new ArrayList<>();
        boolean replaced = false;
        for (Field field : fields) {
            if (field.name().equals(replacement.name())) {
                updated.add(replacement);
                replaced = true;
            } else {
                updated.add(field);
            }
        }
        if (!replaced) {
            updated.add(replacement);
        }
        return new ColumnSchema(table, keyField, updated);
    }

    /**
     * @param name     logical field name
     * @param type     semantic type cells are coerced to
     * @param required whether the table is rejected when no alias is present
     * @param aliases  accepted header names, tried in order
     */
    public record Field(String name, ColumnType type, boolean required, List<String> aliases) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            aliases = List.copyOf(aliases);
            if (aliases.isEmpty()) {
                throw new IllegalArgumentException("Field '" + name + "' needs at least one header alias");
            }
        }

        public static Field required(String name, ColumnType type, String... aliases) {
            return new Field(name, type, true, List.of(aliases));
        }

        public static Field optional(String name, ColumnType type, String... aliases) {
            return new Field(name, type, false, List.of(aliases));
        }
    }
}

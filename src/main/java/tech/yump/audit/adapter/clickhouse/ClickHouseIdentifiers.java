package tech.yump.audit.adapter.clickhouse;

import tech.yump.audit.adapter.InvalidConfigurationException;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation and quoting of identifiers that have to be interpolated into SQL text (database, table and
 * column names cannot be bound as parameters).
 */
final class ClickHouseIdentifiers {

    static final int MAX_LENGTH = 255;

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Set<String> RESERVED = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER", "TABLE", "DATABASE");

    private ClickHouseIdentifiers() {
    }

    /**
     * @param type what the identifier names, used in the error message (e.g. "Database")
     * @throws InvalidConfigurationException when the identifier is empty, too long, malformed or reserved
     */
    static String validate(String identifier, String type) {
        if (identifier == null || identifier.isEmpty()) {
            throw new InvalidConfigurationException(type + " cannot be empty");
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new InvalidConfigurationException(type + " cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new InvalidConfigurationException(type
                    + " must start with a letter or underscore and contain only alphanumeric characters and underscores");
        }
        if (RESERVED.contains(identifier.toUpperCase(Locale.ROOT))) {
            throw new InvalidConfigurationException(type + " cannot be a reserved SQL keyword");
        }
        return identifier;
    }

    static String escape(String identifier) {
        return '`' + identifier.replace("`", "``") + '`';
    }

    static String qualified(String database, String table) {
        return escape(database) + "." + escape(table);
    }
}

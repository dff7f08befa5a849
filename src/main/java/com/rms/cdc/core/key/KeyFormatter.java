package com.rms.cdc.core.key;

import java.util.Objects;
import java.util.regex.Pattern;

import com.rms.cdc.core.error.KeyDerivationException;
import com.rms.cdc.core.model.Change;

/**
 * =====================================================================
 * KeyFormatter
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Derives the key under which a change is upserted on the keyed delivery
 * path. The same logical row always maps to the same key, which is what
 * gives that path last-write-wins semantics under redelivery.
 *
 * CANONICAL FORMAT (LOCKED)
 * -------------------------
 *
 *   BASIC          : <prefix>.<schema>.<table>.<id>
 *   WITH_OPERATION : <prefix>.<schema>.<table>.<action>.<id>
 *
 * Example: mydb.public.orders.delete.42
 *
 * TOKEN RULES
 * -----------
 * Every segment is validated against {@link #TOKEN}, the key character set
 * of the key/value store minus the delimiter:
 *
 *  - not null, not blank
 *  - letters, digits, '-', '_', '/', '='
 *
 * A segment outside the rules is handled by the {@link KeyTokenPolicy}:
 * REJECT fails the derivation, ESCAPE replaces each offending character
 * with '_'.
 *
 * PURITY
 * ------
 * No state besides the policy; identical inputs give identical keys.
 */
public final class KeyFormatter {

    public static final char DELIMITER = '.';

    static final String REPLACEMENT = "_";

    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9_=/-]+$");

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_=/-]");

    private final KeyTokenPolicy tokenPolicy;

    public KeyFormatter() {
        this(KeyTokenPolicy.REJECT);
    }

    public KeyFormatter(KeyTokenPolicy tokenPolicy) {
        this.tokenPolicy = Objects.requireNonNull(tokenPolicy, "tokenPolicy");
    }

    /**
     * Builds the key of a change.
     *
     * @param keyPrefix leading segment, typically the source database name
     * @param change    the change being delivered
     * @param recordId  value of the row's {@code id} column
     * @param keyFormat naming scheme
     * @throws KeyDerivationException if the id is missing or a segment violates the token rules under REJECT
     */
    public String formatKey(String keyPrefix, Change change, Object recordId, KeyFormat keyFormat) {
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(keyFormat, "keyFormat");
        if (recordId == null) {
            throw new KeyDerivationException("Record has no id; cannot derive key for " + change.schema() + "."
                    + change.table());
        }

        StringBuilder key = new StringBuilder()
                .append(token(keyPrefix, "keyPrefix")).append(DELIMITER)
                .append(token(change.schema(), "schema")).append(DELIMITER)
                .append(token(change.table(), "table")).append(DELIMITER);

        if (keyFormat == KeyFormat.WITH_OPERATION) {
            key.append(change.action().name()).append(DELIMITER);
        }

        return key.append(token(String.valueOf(recordId), "recordId")).toString();
    }

    public KeyTokenPolicy tokenPolicy() {
        return tokenPolicy;
    }

    private String token(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new KeyDerivationException(name + " is required");
        }
        if (TOKEN.matcher(value).matches()) {
            return value;
        }
        if (tokenPolicy == KeyTokenPolicy.ESCAPE) {
            return DISALLOWED.matcher(value).replaceAll(REPLACEMENT);
        }
        throw new KeyDerivationException(name + " must match " + TOKEN.pattern() + " but was: " + value);
    }
}

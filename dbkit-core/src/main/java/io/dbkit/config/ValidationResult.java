package io.dbkit.config;

import io.dbkit.DbKitException;

import java.util.Objects;

/**
 * Outcome of {@link ConnectionConfigValidator#check(java.util.Map)}: either a usable
 * configuration or the failure that {@link ConnectionConfigValidator#validate(java.util.Map)}
 * would have thrown.
 */
public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    boolean isValid();

    /**
     * The candidate passed every check.
     *
     * @param config the validated configuration
     */
    record Valid(ConnectionConfig config) implements ValidationResult {
        public Valid {
            Objects.requireNonNull(config, "config");
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * The candidate was rejected.
     *
     * @param error a {@link MissingConnectionParameterException} or
     *              {@link InvalidConnectionParameterException}
     */
    record Invalid(DbKitException error) implements ValidationResult {
        public Invalid {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}

package ch.eth.sis.rocrate.schema;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a schema session.
 *
 * <ul>
 *   <li>{@code ROCRATE_SCHEMA_BASE} - namespace of local ids
 *       (default: http://example.com/)</li>
 *   <li>{@code ROCRATE_SCHEMA_PREFIX} - prefix bound to it
 *       (default: base)</li>
 *   <li>{@code ROCRATE_SCHEMA_DETECT_NAMESPACES} - give frequently used
 *       unknown namespaces a prefix on export (default: true)</li>
 * </ul>
 */
public final class SchemaSettings {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        SchemaSettings.class);

    /** Environment variable for the base namespace. */
    public static final String ENV_BASE = "ROCRATE_SCHEMA_BASE";

    /** Environment variable for the base prefix. */
    public static final String ENV_PREFIX = "ROCRATE_SCHEMA_PREFIX";

    /** Environment variable for namespace detection. */
    public static final String ENV_DETECT_NAMESPACES = "ROCRATE_SCHEMA_DETECT_NAMESPACES";

    /** Default minimum number of uses before a namespace gets a prefix. */
    public static final int DEFAULT_MIN_NAMESPACE_USES = 2;

    private final Namespaces namespaces;

    private final boolean detectNamespaces;

    private final int minNamespaceUses;

    private final boolean prettyPrint;

    private SchemaSettings(final Builder builder) {
        this.namespaces = new Namespaces(builder.baseNamespace, builder.basePrefix);
        this.detectNamespaces = builder.detectNamespaces;
        this.minNamespaceUses = builder.minNamespaceUses;
        this.prettyPrint = builder.prettyPrint;
    }

    /**
     * Returns the default settings.
     *
     * @return default settings
     */
    public static SchemaSettings defaults() {
        return builder().build();
    }

    /**
     * Reads settings from the process environment, using defaults for
     * unset variables.
     *
     * @return the settings
     */
    public static SchemaSettings fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Reads settings from a variable lookup, using defaults for unset
     * variables.
     *
     * @param env variable name to value, null if unset
     * @return the settings
     */
    public static SchemaSettings fromEnvironment(final Function<String, String> env) {
        Builder builder = builder();
        String base = env.apply(ENV_BASE);
        if (base != null && !base.isEmpty()) {
            builder.baseNamespace(base);
        }
        String prefix = env.apply(ENV_PREFIX);
        if (prefix != null && !prefix.isEmpty()) {
            builder.basePrefix(prefix);
        }
        String detect = env.apply(ENV_DETECT_NAMESPACES);
        if (detect != null && !detect.isEmpty()) {
            builder.detectNamespaces(Boolean.parseBoolean(detect));
        }
        SchemaSettings settings = builder.build();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Using {}", settings);
        }
        return settings;
    }

    /**
     * Obtain a {@link Builder} to configure settings.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy using the namespaces specified.
     *
     * @param value the namespaces
     * @return this instance if unchanged, a copy otherwise
     */
    public SchemaSettings withNamespaces(final Namespaces value) {
        if (namespaces.equals(value)) {
            return this;
        }
        return builder()
            .baseNamespace(value.getBase())
            .basePrefix(value.getBasePrefix())
            .detectNamespaces(detectNamespaces)
            .minNamespaceUses(minNamespaceUses)
            .prettyPrint(prettyPrint)
            .build();
    }

    /**
     * Returns the namespaces local ids are minted in.
     *
     * @return the namespaces
     */
    public Namespaces getNamespaces() {
        return namespaces;
    }

    /**
     * Checks whether export binds prefixes for frequently used namespaces.
     *
     * @return true if namespace detection is on
     */
    public boolean isDetectNamespaces() {
        return detectNamespaces;
    }

    /**
     * Returns how often a namespace must occur before a prefix is bound to it.
     *
     * @return the minimum number of uses
     */
    public int getMinNamespaceUses() {
        return minNamespaceUses;
    }

    /**
     * Checks whether JSON output is indented.
     *
     * @return true for indented output
     */
    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    @Override
    public String toString() {
        return "SchemaSettings[" + namespaces.getBasePrefix() + "="
            + namespaces.getBase() + ", detectNamespaces=" + detectNamespaces
            + ", minNamespaceUses=" + minNamespaceUses
            + ", prettyPrint=" + prettyPrint + "]";
    }

    /**
     * Builder for {@link SchemaSettings}.
     */
    public static final class Builder {
        private String baseNamespace = RoCrateVocab.DEFAULT_BASE;
        private String basePrefix = RoCrateVocab.DEFAULT_BASE_PREFIX;
        private boolean detectNamespaces = true;
        private int minNamespaceUses = DEFAULT_MIN_NAMESPACE_USES;
        private boolean prettyPrint = true;

        private Builder() {
        }

        /**
         * Set the namespace local ids are minted in.
         *
         * @param value the namespace IRI, ending in '/' or '#'
         * @return this builder
         */
        public Builder baseNamespace(final String value) {
            this.baseNamespace = Objects.requireNonNull(value, "value");
            return this;
        }

        /**
         * Set the prefix bound to the base namespace.
         *
         * @param value the prefix
         * @return this builder
         */
        public Builder basePrefix(final String value) {
            this.basePrefix = Objects.requireNonNull(value, "value");
            return this;
        }

        /**
         * Enable or disable prefix detection for unknown namespaces.
         *
         * @param value true to detect
         * @return this builder
         */
        public Builder detectNamespaces(final boolean value) {
            this.detectNamespaces = value;
            return this;
        }

        /**
         * Set how often a namespace must be used to get a prefix.
         *
         * @param value at least 1
         * @return this builder
         */
        public Builder minNamespaceUses(final int value) {
            if (value < 1) {
                throw new IllegalArgumentException(
                    "minNamespaceUses must be at least 1: " + value);
            }
            this.minNamespaceUses = value;
            return this;
        }

        /**
         * Enable or disable indentation of written documents.
         *
         * @param value true to indent
         * @return this builder
         */
        public Builder prettyPrint(final boolean value) {
            this.prettyPrint = value;
            return this;
        }

        /**
         * Build the settings.
         *
         * @return the settings
         * @throws IllegalArgumentException if the base namespace or prefix
         *     is invalid
         */
        public SchemaSettings build() {
            return new SchemaSettings(this);
        }
    }
}

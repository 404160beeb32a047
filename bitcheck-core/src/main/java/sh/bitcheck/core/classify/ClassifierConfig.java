// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.classify;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bitcheck.core.types.Network;

/**
 * Configuration for {@link AddressClassifier}.
 *
 * <p>
 * Only addresses of the enabled networks are accepted. Base58 version bytes
 * and Bech32 prefixes of other networks are rejected with
 * {@code UNKNOWN_VERSION} and {@code UNKNOWN_PREFIX} respectively. The
 * default is mainnet only.
 *
 * <pre>{@code
 * ClassifierConfig config = ClassifierConfig.builder()
 *         .network(Network.MAINNET)
 *         .network(Network.TESTNET)
 *         .build();
 *
 * AddressClassifier classifier = new AddressClassifier(config);
 * }</pre>
 *
 * <p>
 * {@link #fromSystemProperties()} reads {@value #NETWORKS_PROPERTY} as a
 * comma-separated list, e.g. {@code -Dbitcheck.networks=mainnet,testnet}.
 *
 * @param networks the networks whose addresses are accepted; never empty
 * @since 0.1.0
 */
public record ClassifierConfig(Set<Network> networks) {

    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    public static final String NETWORKS_PROPERTY = "bitcheck.networks";

    private static final ClassifierConfig DEFAULTS = new ClassifierConfig(EnumSet.of(Network.MAINNET));

    public ClassifierConfig {
        Objects.requireNonNull(networks, "networks");
        if (networks.isEmpty()) {
            throw new IllegalArgumentException("at least one network must be enabled");
        }
        networks = Collections.unmodifiableSet(EnumSet.copyOf(networks));
    }

    /**
     * Mainnet only.
     */
    public static ClassifierConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@value #NETWORKS_PROPERTY}. Unknown names are skipped with a warning;
     * a missing, blank or entirely unknown value yields {@link #defaults()}.
     */
    public static ClassifierConfig fromSystemProperties() {
        return parse(System.getProperty(NETWORKS_PROPERTY));
    }

    static ClassifierConfig parse(final String value) {
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }
        final Builder builder = builder();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            Network.fromId(part).ifPresentOrElse(
                    builder::network,
                    () -> log.warn("Ignoring unknown network '{}' in {}", part.trim(), NETWORKS_PROPERTY));
        }
        if (builder.networks.isEmpty()) {
            log.warn("No usable network in {}='{}', falling back to mainnet", NETWORKS_PROPERTY, value);
            return DEFAULTS;
        }
        return builder.build();
    }

    public boolean accepts(final Network network) {
        return networks.contains(network);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ClassifierConfig}.
     */
    public static final class Builder {
        private final Set<Network> networks = EnumSet.noneOf(Network.class);

        private Builder() {
        }

        public Builder network(final Network network) {
            networks.add(Objects.requireNonNull(network, "network"));
            return this;
        }

        public Builder networks(final Collection<Network> values) {
            Objects.requireNonNull(values, "values").forEach(this::network);
            return this;
        }

        public ClassifierConfig build() {
            return new ClassifierConfig(networks);
        }
    }
}

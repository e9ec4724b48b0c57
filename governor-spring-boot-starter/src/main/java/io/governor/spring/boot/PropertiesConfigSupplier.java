package io.governor.spring.boot;

import io.governor.config.GovernorConfig;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds a {@link GovernorConfig} from the bound {@link GovernorProperties} on
 * every call, so a rebind of {@code enrichment.*} (kill switch, limits, batch
 * sizes) applies to the next sweep, consumed batch or admin call.
 *
 * <p>Invalid properties fail construction. Properties that become invalid later
 * are logged and the last valid config is returned.
 */
public final class PropertiesConfigSupplier implements Supplier<GovernorConfig> {
    private static final Logger logger = Logger.getLogger(PropertiesConfigSupplier.class.getName());

    private final GovernorProperties props;
    private volatile GovernorConfig lastValid;

    public PropertiesConfigSupplier(GovernorProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        this.lastValid = props.toConfig();
    }

    @Override
    public GovernorConfig get() {
        try {
            GovernorConfig config = props.toConfig();
            lastValid = config;
            return config;
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "Invalid enrichment properties, keeping previous settings", e);
            return lastValid;
        }
    }
}

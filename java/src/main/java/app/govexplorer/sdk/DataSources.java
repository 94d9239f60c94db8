package app.govexplorer.sdk;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Chooses the data source implementation for a configuration.
 */
public final class DataSources {

    private static final Logger LOGGER = Logger.getLogger(DataSources.class.getName());

    private DataSources() {
    }

    /**
     * @return a {@link FixtureDataSource} in offline mode, otherwise a {@link GovernanceClient}
     */
    public static GovernanceDataSource fromConfig(Config config) {
        Objects.requireNonNull(config, "config");
        Config resolved = config.withDefaults();
        if (resolved.isOffline()) {
            LOGGER.info(() -> "[governance-explorer] offline mode: reading fixtures from " + resolved.getFixtureDirectory());
            return new FixtureDataSource(resolved.getFixtureDirectory());
        }
        return new GovernanceClient(resolved);
    }
}

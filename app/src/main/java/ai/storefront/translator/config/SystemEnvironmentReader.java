package ai.storefront.translator.config;

import java.util.Optional;

/**
 * Reads environment variables from the host system, falling back to a JVM system property of the same name.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key))
                .or(() -> Optional.ofNullable(System.getProperty(key)));
    }
}

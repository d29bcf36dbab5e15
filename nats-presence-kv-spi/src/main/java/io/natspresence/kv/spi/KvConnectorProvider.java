package io.natspresence.kv.spi;

/**
 * {@link java.util.ServiceLoader} hook for substrate bindings.
 *
 * <p>Bindings register an implementation in
 * {@code META-INF/services/io.natspresence.kv.spi.KvConnectorProvider}.
 */
public interface KvConnectorProvider {

    /**
     * Short binding name, used in diagnostics.
     */
    String name();

    KvConnector connector();
}

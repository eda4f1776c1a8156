/**
 * In-memory transport adapter.
 *
 * <p>Provides a scripted {@link com.ryuqq.relay.core.spi.TransportFactory} for tests
 * and local development. No sockets are opened.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.adapter.inmemory.transport;

package io.github.koszti.bigq.bigquery;

import java.io.IOException;

/**
 * Builds the {@link BigQueryBackend} a query service talks to.
 * Tests use it to hand in fakes.
 */
@FunctionalInterface
public interface BackendFactory
{
    BigQueryBackend createBackend() throws IOException;
}

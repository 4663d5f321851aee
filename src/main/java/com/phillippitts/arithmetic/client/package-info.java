/**
 * Thin typed clients for the arithmetic services.
 *
 * <p>One client per service, created through
 * {@link com.phillippitts.arithmetic.client.ArithmeticServiceClients}. Clients perform no
 * validation of their own; they rely on the service and surface every non-success outcome as a
 * {@link com.phillippitts.arithmetic.exception.ServiceCallException}.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.client;

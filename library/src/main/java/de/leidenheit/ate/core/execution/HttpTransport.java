package de.leidenheit.ate.core.execution;

import de.leidenheit.ate.core.model.ResolvedRequest;

/**
 * Performs the network call of a resolved request. Blocking.
 */
public interface HttpTransport {

    ResponseObject dispatch(final ResolvedRequest request);
}

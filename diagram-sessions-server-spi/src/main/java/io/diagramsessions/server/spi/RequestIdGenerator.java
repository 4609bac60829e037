package io.diagramsessions.server.spi;

/**
 * Strategy for generating ids of server-originated identifiable requests.
 *
 * <p>Ids must be unique per session for as long as the request is outstanding.
 */
@FunctionalInterface
public interface RequestIdGenerator {

    /**
     * Generate the next request id.
     *
     * @param clientId session the request is sent to
     */
    String next(String clientId);
}

package com.questrail.socket.api;

import java.io.IOException;
import java.io.InputStream;

/**
 * Consumes the response of a one-shot {@link SocketClient#once} exchange.
 */
@FunctionalInterface
public interface ResponseHandler
{
    void handle(InputStream response) throws IOException;
}

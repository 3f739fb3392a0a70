package com.jetlang.h3.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Told about every stream whose application or protocol handling failed. Decides the fate of the connection.
 */
public interface ExceptionHandler {

    void onException(long streamId, Throwable failed);

    class Logging implements ExceptionHandler {
        private static final Logger LOGGER = Logger.getLogger(ExceptionHandler.class.getName());

        @Override
        public void onException(long streamId, Throwable failed) {
            LOGGER.log(Level.WARNING, "Application failed on stream " + streamId, failed);
        }
    }
}

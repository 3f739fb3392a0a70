package com.jetlang.h3.app;

import java.util.concurrent.CompletionStage;

/**
 * Per-stream application entry point. Invoked once for every request or websocket session on the connection's
 * fiber. The returned stage completes when the application is done with the stream.
 */
public interface Application {

    CompletionStage<Void> call(Scope scope, Receive receive, Send send) throws Exception;
}

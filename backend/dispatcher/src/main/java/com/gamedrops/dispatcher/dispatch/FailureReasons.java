package com.gamedrops.dispatcher.dispatch;

import com.gamedrops.core.model.DispatchOutcome;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public final class FailureReasons {
    public static final String NO_RESULT = "transport: trigger returned no result";

    private static final String TRANSPORT = "transport: ";

    private FailureReasons() {
    }

    public static String httpStatus(int statusCode) {
        return "http " + statusCode;
    }

    public static String describe(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException || current instanceof HttpTimeoutException) {
                return DispatchOutcome.TIMEOUT;
            }
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof UnknownHostException) {
                return "unknown host: " + messageOf(current);
            }
            if (current instanceof ConnectException) {
                return "connection refused: " + messageOf(current);
            }
            if (current instanceof InterruptedException) {
                return DispatchOutcome.INTERRUPTED;
            }
            if (current instanceof CancellationException) {
                return TRANSPORT + "cancelled";
            }
        }
        Throwable root = rootCause(error);
        return TRANSPORT + root.getClass().getSimpleName() + ": " + messageOf(root);
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable throwable) {
        return throwable.getMessage() == null ? throwable.getClass().getSimpleName() : throwable.getMessage();
    }
}

package com.netaudit.topology.discovery.session;

import net.schmizz.sshj.transport.TransportException;
import net.schmizz.sshj.userauth.UserAuthException;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

public final class SessionErrorClassifier {

    private SessionErrorClassifier() {}

    public static SessionException classify(SessionPhase phase, Throwable error) {
        if (error instanceof SessionException sessionException) {
            return sessionException;
        }
        String message = describe(error);
        if (hasCause(error, UserAuthException.class)) {
            return new AuthenticationFailedException(phase, message, error);
        }
        if (isTransportFailure(error)) {
            return new SessionTimeoutException(phase, message, error);
        }
        return new UnexpectedSessionException(phase, message, error);
    }

    static boolean isTransportFailure(Throwable error) {
        return hasCause(error, TimeoutException.class)
            || hasCause(error, SocketTimeoutException.class)
            || hasCause(error, ConnectException.class)
            || hasCause(error, NoRouteToHostException.class)
            || hasCause(error, UnknownHostException.class)
            || hasCause(error, SocketException.class)
            || hasCause(error, EOFException.class)
            || hasCause(error, TransportException.class);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    }
}

package org.github.rmqueue.client.rabbitmq;

import com.google.common.base.Throwables;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import org.github.rmqueue.client.QueueConnectionException;
import org.github.rmqueue.client.QueueException;
import org.github.rmqueue.client.QueueOperationException;

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

final class RabbitMQExceptions {

    private RabbitMQExceptions() {}

    /**
     * Whether {@code e} means the connection itself failed, as opposed to a single
     * channel or operation. The first decisive exception in the cause chain wins.
     */
    static boolean isConnectionFailure(final Throwable e) {
        for (final Throwable cause : Throwables.getCausalChain(e)) {
            if (cause instanceof ShutdownSignalException) {
                return ((ShutdownSignalException) cause).isHardError();
            }
            if (cause instanceof SocketException
                    || cause instanceof SocketTimeoutException
                    || cause instanceof UnknownHostException
                    || cause instanceof EOFException
                    || cause instanceof TimeoutException
                    || cause instanceof PossibleAuthenticationFailureException) {
                return true;
            }
        }
        return false;
    }

    static QueueException translate(final String message, final Exception e) {
        if (isConnectionFailure(e)) {
            return new QueueConnectionException(message, e);
        }
        return new QueueOperationException(message, e);
    }
}

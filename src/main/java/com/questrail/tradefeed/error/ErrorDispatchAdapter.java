package com.questrail.tradefeed.error;

import com.questrail.tradefeed.api.MessageReceiver;

import java.util.Objects;

/**
 * ErrorDispatchAdapter
 * -----------------------------------------------------------------------------
 * Funnels every form of error report into one {@code error} dispatch.
 *
 * <h2>Why errors need their own path</h2>
 * Unlike other feed events, errors historically arrive in three incompatible
 * call shapes (see {@link ErrorArgs}). A plain positional zip would put a bare
 * message string into {@code id}. This adapter classifies the arguments and
 * forwards the canonical mapping to {@link MessageReceiver#dispatch}.
 *
 * <p>The adapter never delivers to listeners itself and never throws for an
 * unrecognized argument combination.</p>
 */
public final class ErrorDispatchAdapter
{
    /**
     * Name of the message type every error is dispatched as.
     */
    public static final String ERROR_TYPE = "error";

    private final MessageReceiver receiver;

    public ErrorDispatchAdapter(MessageReceiver receiver) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
    }

    /**
     * Dispatches an error given an id, code and message.
     */
    public void error(int id, int errorCode, String errorMsg) {
        forward(new ErrorArgs.Coded(id, errorCode, errorMsg));
    }

    /**
     * Dispatches an error given only a message.
     */
    public void error(String errorMsg) {
        forward(new ErrorArgs.Text(errorMsg));
    }

    /**
     * Dispatches an error given some value, classified by its runtime type.
     */
    public void error(Object value) {
        forward(ErrorArgs.resolve(new Object[] { value }));
    }

    /**
     * Dispatches an error from raw positional arguments, classified by count
     * and runtime type.
     */
    public void dispatchError(Object... args) {
        forward(ErrorArgs.resolve(args));
    }

    private void forward(ErrorArgs args) {
        receiver.dispatch(ERROR_TYPE, args.toFields());
    }
}

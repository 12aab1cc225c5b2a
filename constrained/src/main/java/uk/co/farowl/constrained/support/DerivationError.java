// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.constrained.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the definition of a container class cannot
 * be relied on to work. A {@code ConstraintViolation} (that a client
 * might reasonably catch) is not then appropriate. A
 * {@code DerivationError} is typically thrown while resolving the
 * declared constraints of a class, or while generating one.
 */
public class DerivationError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for derivation errors. A proportion of these are thrown
     * during class initialisation, where they may be swallowed without
     * trace: this gives us a second chance to notice.
     */
    static final Logger logger =
            LoggerFactory.getLogger(DerivationError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DerivationError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the derivation error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DerivationError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(notNull(cause.getMessage(), "(no message)"));
    }

    /**
     * @param msg a string or {@code null}
     * @param defaultMsg a string or {@code null}
     * @return non-{@code null} {@code msg} or {@code defaultMsg}
     */
    private static String notNull(String msg, String defaultMsg) {
        return msg != null ? msg : defaultMsg;
    }
}

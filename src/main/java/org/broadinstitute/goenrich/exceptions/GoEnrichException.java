package org.broadinstitute.goenrich.exceptions;

/**
 * <p/>
 * Class GoEnrichException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class GoEnrichException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GoEnrichException( String msg ) {
        super(msg);
    }

    public GoEnrichException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of GoEnrichException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends GoEnrichException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }

    /**
     * Numerical failure while evaluating an exact test, for instance when the underlying distribution
     * cannot represent the combinatorial terms of a table.
     */
    public static class ComputationException extends GoEnrichException {
        private static final long serialVersionUID = 0L;

        public ComputationException( final String message ) {
            super(message);
        }

        public ComputationException( final String message, final Throwable throwable ) {
            super(message, throwable);
        }
    }
}

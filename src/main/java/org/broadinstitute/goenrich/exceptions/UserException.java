package org.broadinstitute.goenrich.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * annotation records without an identifier or count tables whose totals do not add up.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final File file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message));
        }

        public CouldNotReadInputFile(final File file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message), cause);
        }

        public CouldNotReadInputFile(final Path file, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }

        public CouldNotReadInputFile(final String message) {
            super(message);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.getAbsolutePath(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final File file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }

        public BadInput(final String message, final Throwable cause) {
            super("Bad input: " + message, cause);
        }
    }

    /**
     * An annotation record reached the index builder without a feature identifier.
     */
    public static class MissingFeatureIdentifier extends BadInput {
        private static final long serialVersionUID = 0L;

        public MissingFeatureIdentifier(final String record) {
            super(String.format("annotation record %s does not have a feature identifier", record));
        }
    }

    /**
     * A 2x2 count table with negative cells or totals that disagree with the population it was built from.
     */
    public static class MalformedContingencyTable extends BadInput {
        private static final long serialVersionUID = 0L;

        public MalformedContingencyTable(final String message) {
            super("malformed contingency table: " + message);
        }
    }

    /**
     * The term-to-feature relation refers to features that are not part of the feature universe.
     */
    public static class InconsistentAnnotationIndex extends BadInput {
        private static final long serialVersionUID = 0L;

        public InconsistentAnnotationIndex(final String termId, final int featuresOutsideUniverse) {
            super(String.format("term %s is annotated on %d feature(s) that are not part of the feature universe",
                    termId, featuresOutsideUniverse));
        }
    }

    /**
     * Multiple-testing correction was requested over zero hypotheses.
     */
    public static class EmptyHypothesisSet extends BadInput {
        private static final long serialVersionUID = 0L;

        public EmptyHypothesisSet() {
            super("cannot adjust p-values for an empty set of hypotheses");
        }
    }
}

package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.goenrich.exceptions.UserException;

/**
 * 2x2 counts for one term against a feature set of interest.
 * <pre>
 *                     annotated   not annotated
 *     in set              a             b
 *     not in set          c             d
 * </pre>
 * so that {@code a + b} is the size of the set, {@code a + c} the number of features annotated with the term
 * and {@code a + b + c + d} the size of the universe.
 */
public final class ContingencyTable {

    private final int a;
    private final int b;
    private final int c;
    private final int d;

    /**
     * @throws UserException.MalformedContingencyTable if any count is negative.
     */
    public ContingencyTable(final int a, final int b, final int c, final int d) {
        if (a < 0 || b < 0 || c < 0 || d < 0) {
            throw new UserException.MalformedContingencyTable(String.format("counts cannot be negative: a=%d, b=%d, c=%d, d=%d", a, b, c, d));
        }
        if ((long) a + b + c + d > Integer.MAX_VALUE) {
            throw new UserException.MalformedContingencyTable(String.format("total count is too large: a=%d, b=%d, c=%d, d=%d", a, b, c, d));
        }
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /** Features in the set annotated with the term. */
    public int getA() {
        return a;
    }

    /** Features in the set not annotated with the term. */
    public int getB() {
        return b;
    }

    /** Features outside the set annotated with the term. */
    public int getC() {
        return c;
    }

    /** Features outside the set not annotated with the term. */
    public int getD() {
        return d;
    }

    public int getSetSize() {
        return a + b;
    }

    public int getAnnotatedCount() {
        return a + c;
    }

    public int getTotal() {
        return a + b + c + d;
    }

    /**
     * @return a new {@code int[2][2]} laid out as {@link org.broadinstitute.goenrich.utils.FisherExactTest} expects.
     */
    public int[][] toMatrix() {
        return new int[][]{{a, b}, {c, d}};
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ContingencyTable that = (ContingencyTable) o;
        return a == that.a && b == that.b && c == that.c && d == that.d;
    }

    @Override
    public int hashCode() {
        int result = a;
        result = 31 * result + b;
        result = 31 * result + c;
        result = 31 * result + d;
        return result;
    }

    @Override
    public String toString() {
        return String.format("ContingencyTable{a=%d, b=%d, c=%d, d=%d}", a, b, c, d);
    }
}

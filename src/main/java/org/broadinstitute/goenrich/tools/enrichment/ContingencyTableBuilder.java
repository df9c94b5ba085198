package org.broadinstitute.goenrich.tools.enrichment;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes the {@link ContingencyTable} of every annotated term of an {@link AnnotationIndex} against
 * a feature set of interest.
 * <p>
 *     Identifiers of the set that are not part of the universe are ignored; repeated identifiers count once.
 * </p>
 */
public final class ContingencyTableBuilder {

    private static final Logger logger = LogManager.getLogger(ContingencyTableBuilder.class);

    static final int MAX_LOGGED_IDS = 10;

    private ContingencyTableBuilder() {}

    /**
     * @return the distinct members of {@code featureSetOfInterest} that are part of the universe of {@code index},
     *         in first-seen order.
     */
    public static Set<String> restrictToUniverse(final AnnotationIndex index, final Collection<String> featureSetOfInterest) {
        Utils.nonNull(index, "the index cannot be null");
        Utils.nonNull(featureSetOfInterest, "the feature set of interest cannot be null");
        final Set<String> result = new LinkedHashSet<>();
        final Set<String> ignored = new LinkedHashSet<>();
        for (final String featureId : featureSetOfInterest) {
            if (featureId != null && index.getUniverse().contains(featureId)) {
                result.add(featureId);
            } else {
                ignored.add(featureId);
            }
        }
        if (!ignored.isEmpty()) {
            logger.warn(String.format("Ignoring %d feature identifier(s) of the set of interest that are not part of the annotated genome: %s",
                    ignored.size(), summarizeIds(ignored)));
        }
        return result;
    }

    /**
     * @return the first {@link #MAX_LOGGED_IDS} ids of {@code ids}, followed by the number of ids left out if any.
     */
    @VisibleForTesting
    static String summarizeIds(final Collection<String> ids) {
        final String shown = ids.stream().limit(MAX_LOGGED_IDS).map(String::valueOf).collect(Collectors.joining(", "));
        return ids.size() <= MAX_LOGGED_IDS ? shown : String.format("%s and %d more", shown, ids.size() - MAX_LOGGED_IDS);
    }

    /**
     * Builds the table of each term of the index.
     *
     * @return term id to table, ordered by term id; empty if the index has no term.
     * @throws UserException.InconsistentAnnotationIndex if a term is annotated on features outside the universe.
     */
    public static SortedMap<String, ContingencyTable> buildTables(final AnnotationIndex index, final Collection<String> featureSetOfInterest) {
        final Set<String> featureSet = restrictToUniverse(index, featureSetOfInterest);
        final int universeSize = index.getUniverseSize();
        final int setSize = featureSet.size();

        final SortedMap<String, ContingencyTable> tables = new TreeMap<>();
        for (final String termId : index.getTermIds()) {
            final Set<String> annotatedFeatures = index.getFeatures(termId);
            int outsideUniverse = 0;
            int inSet = 0;
            for (final String featureId : annotatedFeatures) {
                if (!index.getUniverse().contains(featureId)) {
                    outsideUniverse++;
                } else if (featureSet.contains(featureId)) {
                    inSet++;
                }
            }
            if (outsideUniverse > 0) {
                throw new UserException.InconsistentAnnotationIndex(termId, outsideUniverse);
            }
            final int a = inSet;
            final int b = setSize - a;
            final int c = annotatedFeatures.size() - a;
            final int d = universeSize - setSize - c;
            tables.put(termId, new ContingencyTable(a, b, c, d));
        }
        return tables;
    }
}

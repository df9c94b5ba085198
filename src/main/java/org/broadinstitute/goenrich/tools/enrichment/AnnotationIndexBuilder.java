package org.broadinstitute.goenrich.tools.enrichment;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds an {@link AnnotationIndex} out of feature annotation records.
 * <p>
 *     Only Gene Ontology terms (ids of the form {@code GO:<digits>}, prefix case-insensitive) are indexed; terms from
 *     other namespaces are dropped. Records sharing a feature id are merged: their terms are pooled and the last
 *     non-null function and feature type win. When two records give a term different labels the last one wins.
 * </p>
 */
public final class AnnotationIndexBuilder {

    private static final Logger logger = LogManager.getLogger(AnnotationIndexBuilder.class);

    public static final Pattern GO_TERM_ID_PATTERN = Pattern.compile("^[gG][oO]:\\d+$");

    private final SetMultimap<String, String> termsByFeature = LinkedHashMultimap.create();
    private final Map<String, String> termLabels = new LinkedHashMap<>();
    private final Set<String> universe = new LinkedHashSet<>();
    private final Map<String, String> functions = new HashMap<>();
    private final Map<String, String> featureTypes = new HashMap<>();
    private long droppedTermCount = 0;

    /**
     * Adds a record to the index under construction.
     *
     * @throws UserException.MissingFeatureIdentifier if the record has no feature id.
     */
    public AnnotationIndexBuilder add(final FeatureAnnotationRecord record) {
        Utils.nonNull(record, "the record cannot be null");
        final String featureId = record.getFeatureId();
        if (StringUtils.isBlank(featureId)) {
            throw new UserException.MissingFeatureIdentifier(record.toString());
        }

        universe.add(featureId);
        if (record.getFunction() != null) {
            functions.put(featureId, record.getFunction());
        }
        if (record.getFeatureType() != null) {
            featureTypes.put(featureId, record.getFeatureType());
        }

        for (final Map.Entry<String, String> term : record.getOntologyTerms().entrySet()) {
            if (isGoTermId(term.getKey())) {
                termsByFeature.put(featureId, term.getKey());
                termLabels.put(term.getKey(), Objects.toString(term.getValue(), ""));
            } else {
                droppedTermCount++;
            }
        }
        return this;
    }

    public AnnotationIndexBuilder addAll(final Iterable<FeatureAnnotationRecord> records) {
        Utils.nonNull(records, "the records cannot be null");
        for (final FeatureAnnotationRecord record : records) {
            add(record);
        }
        return this;
    }

    /**
     * @return an index holding every record added so far.
     */
    public AnnotationIndex build() {
        if (droppedTermCount > 0) {
            logger.debug(String.format("Dropped %d ontology term annotations outside the Gene Ontology namespace", droppedTermCount));
        }
        final Map<String, AnnotationIndex.FeatureInfo> featureInfo = new LinkedHashMap<>();
        for (final String featureId : universe) {
            featureInfo.put(featureId, new AnnotationIndex.FeatureInfo(functions.get(featureId), featureTypes.get(featureId)));
        }
        final AnnotationIndex index = new AnnotationIndex(termsByFeature, termLabels, universe, featureInfo);
        logger.debug(String.format("Indexed %d features and %d GO terms (%d annotations)",
                index.getUniverseSize(), index.getTermIds().size(), index.getTermsByFeature().size()));
        return index;
    }

    /**
     * Builds the index of a full collection of records.
     */
    public static AnnotationIndex buildIndex(final Iterable<FeatureAnnotationRecord> records) {
        return new AnnotationIndexBuilder().addAll(records).build();
    }

    public static boolean isGoTermId(final String termId) {
        return termId != null && GO_TERM_ID_PATTERN.matcher(termId).matches();
    }
}

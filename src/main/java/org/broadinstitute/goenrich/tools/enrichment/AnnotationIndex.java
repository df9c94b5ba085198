package org.broadinstitute.goenrich.tools.enrichment;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bidirectional relation between genome features and the Gene Ontology terms they are annotated with.
 * <p>
 *     The term-to-feature direction is the inverse of the feature-to-term direction, so both always hold the same
 *     (feature, term) pairs. Every term has exactly one label. The universe holds every feature of the genome,
 *     including those without any term. Instances are immutable.
 * </p>
 */
public final class AnnotationIndex {

    private final ImmutableSetMultimap<String, String> termsByFeature;
    private final ImmutableSetMultimap<String, String> featuresByTerm;
    private final ImmutableMap<String, String> termLabels;
    private final ImmutableSet<String> universe;
    private final ImmutableMap<String, FeatureInfo> featureInfo;

    /**
     * Descriptive metadata kept for each feature of the universe.
     */
    public static final class FeatureInfo {
        private final String function;
        private final String featureType;

        public FeatureInfo(final String function, final String featureType) {
            this.function = function;
            this.featureType = featureType;
        }

        /**
         * @return may be {@code null}.
         */
        public String getFunction() {
            return function;
        }

        /**
         * @return may be {@code null}.
         */
        public String getFeatureType() {
            return featureType;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final FeatureInfo that = (FeatureInfo) o;
            return Objects.equals(function, that.function) && Objects.equals(featureType, that.featureType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(function, featureType);
        }

        @Override
        public String toString() {
            return "FeatureInfo{function='" + function + "', featureType='" + featureType + "'}";
        }
    }

    /**
     * Use {@link AnnotationIndexBuilder} to create instances from annotation records.
     *
     * @param termsByFeature feature id to the ids of its terms.
     * @param termLabels term id to label; must cover every term of {@code termsByFeature}.
     * @param universe all feature ids of the genome.
     * @param featureInfo metadata per feature id.
     */
    AnnotationIndex(final SetMultimap<String, String> termsByFeature, final Map<String, String> termLabels,
                    final Set<String> universe, final Map<String, FeatureInfo> featureInfo) {
        Utils.nonNull(termsByFeature, "the feature to term relation cannot be null");
        Utils.nonNull(termLabels, "the term labels cannot be null");
        Utils.nonNull(universe, "the universe cannot be null");
        Utils.nonNull(featureInfo, "the feature metadata cannot be null");
        this.termsByFeature = ImmutableSetMultimap.copyOf(termsByFeature);
        this.featuresByTerm = this.termsByFeature.inverse();
        Utils.validateArg(termLabels.keySet().equals(featuresByTerm.keySet()),
                () -> "labelled terms and annotated terms differ: " + termLabels.keySet() + " vs " + featuresByTerm.keySet());
        this.termLabels = ImmutableMap.copyOf(termLabels);
        this.universe = ImmutableSet.copyOf(universe);
        this.featureInfo = ImmutableMap.copyOf(featureInfo);
    }

    /**
     * @return the ids of the terms of a feature; empty if the feature has none or is unknown.
     */
    public Set<String> getTerms(final String featureId) {
        return termsByFeature.get(Utils.nonNull(featureId));
    }

    /**
     * @return the ids of the features annotated with a term; empty if the term is unknown.
     */
    public Set<String> getFeatures(final String termId) {
        return featuresByTerm.get(Utils.nonNull(termId));
    }

    public ImmutableSetMultimap<String, String> getTermsByFeature() {
        return termsByFeature;
    }

    public ImmutableSetMultimap<String, String> getFeaturesByTerm() {
        return featuresByTerm;
    }

    /**
     * @return the ids of every term with at least one annotated feature.
     */
    public Set<String> getTermIds() {
        return termLabels.keySet();
    }

    public String getTermLabel(final String termId) {
        return termLabels.get(Utils.nonNull(termId));
    }

    public ImmutableMap<String, String> getTermLabels() {
        return termLabels;
    }

    public ImmutableSet<String> getUniverse() {
        return universe;
    }

    public int getUniverseSize() {
        return universe.size();
    }

    /**
     * @return {@code null} if the feature is not part of the universe.
     */
    public FeatureInfo getFeatureInfo(final String featureId) {
        return featureInfo.get(Utils.nonNull(featureId));
    }
}

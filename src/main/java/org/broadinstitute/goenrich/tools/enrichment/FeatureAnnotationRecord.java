package org.broadinstitute.goenrich.tools.enrichment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One genome feature as provided by the annotation source, before validation.
 * <p>
 *     The feature identifier is not checked here; {@link AnnotationIndexBuilder} rejects records without one.
 *     Ontology terms are given as a map from namespace-qualified term id (e.g. {@code GO:0005634}) to its label,
 *     and may mix namespaces.
 * </p>
 */
public final class FeatureAnnotationRecord {

    private final String featureId;
    private final String function;
    private final String featureType;
    private final Map<String, String> ontologyTerms;

    /**
     * @param featureId identifier of the feature, may be {@code null} or blank (rejected when indexed).
     * @param function free-text function, may be {@code null}.
     * @param featureType feature type tag (e.g. "gene"), may be {@code null}.
     * @param ontologyTerms term id to label, may be {@code null} for a feature with no terms.
     */
    public FeatureAnnotationRecord(final String featureId, final String function, final String featureType,
                                   final Map<String, String> ontologyTerms) {
        this.featureId = featureId;
        this.function = function;
        this.featureType = featureType;
        this.ontologyTerms = ontologyTerms == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(ontologyTerms));
    }

    public String getFeatureId() {
        return featureId;
    }

    public String getFunction() {
        return function;
    }

    public String getFeatureType() {
        return featureType;
    }

    /**
     * @return never {@code null}, an unmodifiable map.
     */
    public Map<String, String> getOntologyTerms() {
        return ontologyTerms;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final FeatureAnnotationRecord that = (FeatureAnnotationRecord) o;
        return Objects.equals(featureId, that.featureId) &&
                Objects.equals(function, that.function) &&
                Objects.equals(featureType, that.featureType) &&
                ontologyTerms.equals(that.ontologyTerms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(featureId, function, featureType, ontologyTerms);
    }

    @Override
    public String toString() {
        return "FeatureAnnotationRecord{" +
                "featureId='" + featureId + '\'' +
                ", function='" + function + '\'' +
                ", featureType='" + featureType + '\'' +
                ", ontologyTerms=" + ontologyTerms +
                '}';
    }
}

package org.broadinstitute.goenrich.utils.help;

/**
 * Names and summaries of the tool categories shown in the usage listing.
 */
public final class HelpConstants {

    private HelpConstants() {}

    public static final String DOC_CAT_FUNCTIONAL_ENRICHMENT = "Functional Enrichment";
    public static final String DOC_CAT_FUNCTIONAL_ENRICHMENT_SUMMARY = "Tools that test gene sets for over-representation of Gene Ontology terms";
}

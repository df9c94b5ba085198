package org.broadinstitute.goenrich.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.goenrich.utils.help.HelpConstants;

/**
 * Tools that test feature sets for over-representation of ontology terms
 */
public final class FunctionalEnrichmentProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return HelpConstants.DOC_CAT_FUNCTIONAL_ENRICHMENT; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_FUNCTIONAL_ENRICHMENT_SUMMARY; }
}

package org.broadinstitute.goenrich;

import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.tools.enrichment.FunctionalEnrichment;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.Set;

public final class MainUnitTest extends GoEnrichBaseTest {

    @Test
    public void testNoToolPrintsUsage() {
        final Object[] result = new Object[1];
        final String out = captureStdout(() -> result[0] = new Main().instanceMain(new String[]{}));
        Assert.assertNull(result[0]);
        assertContains(out, "Available Programs:");
        assertContains(out, "FunctionalEnrichment");
        assertContains(out, "Gene Ontology term enrichment of a set of features.");
    }

    @Test
    public void testToolHelp() {
        final Object[] result = new Object[1];
        captureStderr(() -> result[0] = new Main().instanceMain(new String[]{"FunctionalEnrichment", "--help"}));
        Assert.assertEquals(result[0], 0);
    }

    @Test
    public void testUnknownToolSuggestsTheClosestOne() {
        try {
            captureStderr(() -> new Main().instanceMain(new String[]{"FunctionalEnrichmnt"}));
            Assert.fail("an unknown tool must be rejected");
        } catch (final UserException e) {
            assertContains(e.getMessage(), "FunctionalEnrichment");
        }
    }

    @Test
    public void testSuggestedAlternateCommand() {
        final Set<Class<?>> classes = Collections.singleton(FunctionalEnrichment.class);
        final String typo = new Main().getSuggestedAlternateCommand(classes, "FunctionalEnrichmnt");
        assertContains(typo, "'FunctionalEnrichmnt' is not a valid command.");
        assertContains(typo, "Did you mean this?");
        assertContains(typo, "FunctionalEnrichment");

        // no suggestion when every program is an equally good match
        final String prefix = new Main().getSuggestedAlternateCommand(classes, "Functional");
        Assert.assertFalse(prefix.contains("Did you mean"), prefix);
    }
}

package de.leipzig.htwk.patentrisk.service.claims;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimType;

class ClaimExtractorTest {

    private final ClaimExtractor extractor = new ClaimExtractor();

    @Test
    void splitsNumberedClaimsAndLinksDependentToParent() {
        List<Claim> claims = extractor.extract("P1",
            "1. An apparatus comprising X.\n2. The apparatus of claim 1, further comprising Y.");

        assertEquals(2, claims.size());

        Claim first = claims.get(0);
        assertEquals(1, first.getClaimNumber());
        assertTrue(first.isIndependent());
        assertNull(first.getParentClaimNumber());
        assertEquals("An apparatus comprising X.", first.getText());
        assertEquals(ClaimType.APPARATUS, first.getClaimType());

        Claim second = claims.get(1);
        assertEquals(2, second.getClaimNumber());
        assertFalse(second.isIndependent());
        assertEquals(1, second.getParentClaimNumber());
        assertEquals("P1", second.getPatentId());
    }

    @Test
    void blankTextYieldsNoClaims() {
        assertTrue(extractor.extract("P1", null).isEmpty());
        assertTrue(extractor.extract("P1", "   \n ").isEmpty());
    }

    @Test
    void unnumberedTextBecomesSingleIndependentClaim() {
        List<Claim> claims = extractor.extract("P1", "A method for   brewing coffee\nusing cold water.");

        assertEquals(1, claims.size());
        assertEquals(1, claims.get(0).getClaimNumber());
        assertTrue(claims.get(0).isIndependent());
        assertEquals("A method for brewing coffee using cold water.", claims.get(0).getText());
        assertEquals(ClaimType.METHOD, claims.get(0).getClaimType());
    }

    @Test
    void decimalNumbersAtLineStartAreNotClaimNumbers() {
        List<Claim> claims = extractor.extract("P1", "1. A bolt having a length of\n3.5 mm.\n2. The bolt of claim 1.");

        assertEquals(2, claims.size());
        assertEquals("A bolt having a length of 3.5 mm.", claims.get(0).getText());
    }

    @Test
    void acceptsClaimPrefixAndParenthesisNumbering() {
        List<Claim> claims = extractor.extract("P1", "Claim 1: A widget.\nClaim 2: The widget of claim 1.\n3) The widget of claim 2.");

        assertEquals(List.of(1, 2, 3), claims.stream().map(Claim::getClaimNumber).toList());
        assertEquals(2, claims.get(2).getParentClaimNumber());
    }

    @Test
    void multipleReferencesResolveToSmallestEarlierClaim() {
        List<Claim> claims = extractor.extract("P1", String.join("\n",
            "1. A pump.",
            "2. The pump of claim 1.",
            "3. A motor.",
            "4. The assembly of claim 3 or claim 2, wherein the pump is driven by the motor."));

        assertEquals(2, claims.get(3).getParentClaimNumber());
    }

    @Test
    void forwardAndSelfReferencesAreIgnored() {
        assertNull(ClaimExtractor.findParent(2, "The device of claim 5", Set.of(1, 2, 5)));
        assertNull(ClaimExtractor.findParent(2, "The device of claim 2", Set.of(1, 2)));
        assertNull(ClaimExtractor.findParent(3, "The device of claim 7", Set.of(1, 2, 3)));
        assertEquals(1, ClaimExtractor.findParent(4, "according to any of claims 1 to 3", Set.of(1, 2, 3, 4)));
    }

    @Test
    void firstOccurrenceOfDuplicateNumberWins() {
        List<Claim> claims = extractor.extract("P1", "1. A lamp.\n1. A second lamp.\n2. The lamp of claim 1.");

        assertEquals(2, claims.size());
        assertEquals("A lamp.", claims.get(0).getText());
    }

    @Test
    void outOfOrderClaimsAreSortedByNumber() {
        List<Claim> claims = extractor.extract("P1", "2. The lamp of claim 1.\n1. A lamp.");

        assertEquals(List.of(1, 2), claims.stream().map(Claim::getClaimNumber).toList());
        // parent must precede the claim in numbering, not in text order
        assertEquals(1, claims.get(1).getParentClaimNumber());
    }

    @Test
    void classifiesByHeadNoun() {
        assertEquals(ClaimType.METHOD, extractor.classify("A method for encoding video, comprising"));
        assertEquals(ClaimType.SYSTEM, extractor.classify("A system comprising a processor"));
        assertEquals(ClaimType.APPARATUS, extractor.classify("A device having a lid"));
        assertEquals(ClaimType.UNSPECIFIED, extractor.classify("A computer-readable medium storing instructions"));
        assertEquals(ClaimType.UNSPECIFIED, extractor.classify("An apparatus and method for sorting"));
        assertEquals(ClaimType.UNSPECIFIED, extractor.classify(""));
    }

    @Test
    void keyElementsFollowTheConnector() {
        List<String> elements = extractor.keyElements(
            "A device comprising a housing, a spring-loaded valve and a sensor configured to measure pressure.");

        assertEquals(List.of("housing", "spring-loaded valve", "sensor"), elements);
    }

    @Test
    void keyElementsIncludeQuotedTermsAndAreCapped() {
        StringBuilder text = new StringBuilder("A \"flux capacitor\" assembly comprising ");
        for (int i = 0; i < 15; i++) {
            text.append("part").append((char) ('a' + i)).append(", ");
        }

        List<String> elements = extractor.keyElements(text.toString());

        assertEquals("flux capacitor", elements.get(0));
        assertEquals(10, elements.size());
    }

    @Test
    void uppercasePreambleIsClassifiedUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(ClaimType.APPARATUS, extractor.classify("A WIRELESS DEVICE COMPRISING AN ANTENNA."));
            assertEquals(ClaimType.APPARATUS, ClaimType.fromString("MACHINE"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}

package de.leipzig.htwk.patentrisk.service.claims;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimType;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits raw claims text into structured claims.
 * <p>
 * Best-effort: text that does not split into numbered blocks, or that trips the parser,
 * becomes a single independent claim 1 so callers always get something to match against.
 */
@Component
@Slf4j
public class ClaimExtractor {

    // "1.", "1)", "Claim 1:" at a line start; "3.5 mm" is not a claim number
    private static final Pattern CLAIM_START = Pattern.compile(
        "(?im)^[ \\t]*(?:claim\\s+)?(\\d{1,3})[ \\t]*[.):](?!\\d)[ \\t]*");

    // "claim 1", "claims 1 and 2", "any of claims 1 to 3", "claims 1, 4 or 5"
    private static final Pattern CLAIM_REFERENCE = Pattern.compile(
        "(?i)\\bclaims?\\s+(\\d+)((?:\\s*(?:,|and|or|to|-)\\s*(?:claim\\s+)?\\d+)*)");

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final Pattern CONNECTOR = Pattern.compile(
        "(?i)\\b(?:comprising|including|having|consisting\\s+of|consists\\s+of|wherein)\\b:?");

    private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"“”]+)[\"”]");

    private static final Pattern ELEMENT_SEPARATOR = Pattern.compile("\\s*[;,]\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_ARTICLE = Pattern.compile(
        "(?i)^(?:(?:a|an|the|said|each|one\\s+or\\s+more|at\\s+least\\s+one|a\\s+plurality\\s+of)\\s+)+");

    private static final Set<String> HEAD_STOP_WORDS = Set.of(
        "for", "of", "to", "in", "on", "according", "as", "that", "which", "configured", "adapted", "storing", "using");

    private static final Set<String> ELEMENT_STOP_WORDS = Set.of(
        "is", "are", "was", "were", "being", "configured", "adapted", "arranged", "operable", "that", "which");

    private static final int MAX_KEY_ELEMENTS = 10;
    private static final int MAX_ELEMENT_WORDS = 4;
    private static final int MAX_HEAD_WORDS = 8;

    /**
     * Extract the claims of one patent, ordered by claim number. Empty text yields no claims.
     */
    public List<Claim> extract(String patentId, String claimsText) {
        if (claimsText == null || claimsText.isBlank()) {
            return List.of();
        }

        String text = preprocess(claimsText);
        try {
            List<Claim> claims = split(patentId, text);
            if (claims.isEmpty()) {
                log.debug("No numbered claims found for patent {}, using whole text as claim 1", patentId);
                return List.of(singleClaim(patentId, text));
            }
            return claims;
        } catch (RuntimeException e) {
            log.warn("Claim extraction failed for patent {}, falling back to a single claim: {}", patentId, e.getMessage());
            return List.of(singleClaim(patentId, text));
        }
    }

    private List<Claim> split(String patentId, String text) {
        Map<Integer, String> blocks = new LinkedHashMap<>();
        Matcher matcher = CLAIM_START.matcher(text);

        int number = -1;
        int bodyStart = -1;
        while (matcher.find()) {
            if (number > 0) {
                addBlock(blocks, number, text.substring(bodyStart, matcher.start()));
            }
            number = Integer.parseInt(matcher.group(1));
            bodyStart = matcher.end();
        }
        if (number > 0) {
            addBlock(blocks, number, text.substring(bodyStart));
        }

        List<Claim> claims = new ArrayList<>(blocks.size());
        for (Map.Entry<Integer, String> block : blocks.entrySet()) {
            int claimNumber = block.getKey();
            String body = block.getValue();
            Integer parent = findParent(claimNumber, body, blocks.keySet());
            claims.add(Claim.builder()
                .patentId(patentId)
                .claimNumber(claimNumber)
                .text(body)
                .independent(parent == null)
                .parentClaimNumber(parent)
                .claimType(classify(body))
                .keyElements(keyElements(body))
                .build());
        }
        claims.sort(Comparator.comparingInt(Claim::getClaimNumber));
        return claims;
    }

    private static void addBlock(Map<Integer, String> blocks, int number, String rawBody) {
        String body = clean(rawBody);
        if (number <= 0 || body.isEmpty()) {
            return;
        }
        // first occurrence of a claim number wins
        blocks.putIfAbsent(number, body);
    }

    /**
     * Smallest referenced claim that exists and precedes this one, or null when the claim stands alone
     */
    static Integer findParent(int claimNumber, String body, Set<Integer> knownNumbers) {
        Integer parent = null;
        Matcher reference = CLAIM_REFERENCE.matcher(body);
        while (reference.find()) {
            Matcher numbers = NUMBER.matcher(reference.group());
            while (numbers.find()) {
                int referenced;
                try {
                    referenced = Integer.parseInt(numbers.group());
                } catch (NumberFormatException e) {
                    continue;
                }
                if (referenced < claimNumber && knownNumbers.contains(referenced)
                        && (parent == null || referenced < parent)) {
                    parent = referenced;
                }
            }
        }
        return parent;
    }

    /**
     * Claim category from the head noun phrase of the preamble. Unknown or mixed heads are UNSPECIFIED.
     */
    public ClaimType classify(String claimText) {
        if (claimText == null || claimText.isBlank()) {
            return ClaimType.UNSPECIFIED;
        }

        Set<ClaimType> found = EnumSet.noneOf(ClaimType.class);
        String[] words = claimText.toLowerCase(Locale.ROOT).split("[^a-z0-9-]+");
        int seen = 0;
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (HEAD_STOP_WORDS.contains(word) || isConnector(word) || ++seen > MAX_HEAD_WORDS) {
                break;
            }
            ClaimType type = ClaimType.fromString(word);
            if (type != ClaimType.UNSPECIFIED) {
                found.add(type);
            }
        }
        return found.size() == 1 ? found.iterator().next() : ClaimType.UNSPECIFIED;
    }

    private static boolean isConnector(String word) {
        return word.equals("comprising") || word.equals("including") || word.equals("having")
            || word.equals("consisting") || word.equals("wherein");
    }

    /**
     * Short noun phrases: quoted terms plus the elements listed after comprising / including / having /
     * consisting of / wherein. Ordered, deduplicated, at most ten.
     */
    public List<String> keyElements(String claimText) {
        if (claimText == null || claimText.isBlank()) {
            return List.of();
        }

        Set<String> elements = new LinkedHashSet<>();

        Matcher quoted = QUOTED.matcher(claimText);
        while (quoted.find()) {
            String phrase = quoted.group(1).trim();
            if (phrase.length() > 3) {
                elements.add(phrase);
            }
        }

        String[] segments = CONNECTOR.split(claimText);
        for (int i = 1; i < segments.length; i++) {
            for (String part : ELEMENT_SEPARATOR.split(segments[i])) {
                String phrase = nounPhrase(part);
                if (phrase.length() > 3) {
                    elements.add(phrase);
                }
            }
        }

        return elements.stream().limit(MAX_KEY_ELEMENTS).toList();
    }

    private static String nounPhrase(String part) {
        String stripped = LEADING_ARTICLE.matcher(part.trim()).replaceFirst("");
        StringBuilder phrase = new StringBuilder();
        int words = 0;
        for (String word : stripped.split("[^\\p{L}\\p{N}-]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (ELEMENT_STOP_WORDS.contains(word.toLowerCase(Locale.ROOT)) || words == MAX_ELEMENT_WORDS) {
                break;
            }
            if (phrase.length() > 0) {
                phrase.append(' ');
            }
            phrase.append(word);
            words++;
        }
        return phrase.toString();
    }

    private Claim singleClaim(String patentId, String text) {
        String body = clean(text);
        return Claim.builder()
            .patentId(patentId)
            .claimNumber(1)
            .text(body)
            .independent(true)
            .claimType(classify(body))
            .keyElements(keyElements(body))
            .build();
    }

    private static String preprocess(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n').replaceAll("[ \\t\\u00A0]+", " ").trim();
    }

    private static String clean(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}

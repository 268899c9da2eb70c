package com.dcruver.clausedrift.segment;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.ClauseCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits contract text into numbered, categorized clauses.
 * Stateless: the same input always yields the same clauses.
 */
@Component
@Slf4j
public class ClauseSegmenter {

    // Blank line(s), or a line break followed by a numbered heading such as "12."
    private static final Pattern BOUNDARY = Pattern.compile("\\r?\\n(?:[ \\t]*\\r?\\n)+|\\r?\\n(?=\\d+\\.)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<ClauseCategory, List<Pattern>> CATEGORY_PATTERNS = new EnumMap<>(ClauseCategory.class);

    static {
        for (ClauseCategory category : ClauseCategory.values()) {
            CATEGORY_PATTERNS.put(category, category.getKeywords().stream()
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword)))
                .toList());
        }
    }

    private final int noiseWordThreshold;

    public ClauseSegmenter(DriftProperties properties) {
        this.noiseWordThreshold = properties.getSegmentation().getNoiseWordThreshold();
    }

    public List<Clause> segment(String versionId, String text) {
        return segment(versionId, text, null);
    }

    /**
     * Segment a document into clauses.
     *
     * @param versionId document version the clauses belong to
     * @param text      full plain-text document
     * @param hints     pre-detected sections; when non-empty each becomes one clause
     * @throws IllegalArgumentException if text is null
     */
    public List<Clause> segment(String versionId, String text, List<SectionHint> hints) {
        if (text == null) {
            throw new IllegalArgumentException("No text to segment for version " + versionId);
        }

        List<Clause> clauses = hints != null && !hints.isEmpty()
            ? segmentSections(versionId, text, hints)
            : segmentParagraphs(versionId, text);

        log.debug("Segmented version {} into {} clauses", versionId, clauses.size());
        return clauses;
    }

    private List<Clause> segmentSections(String versionId, String text, List<SectionHint> hints) {
        List<Clause> clauses = new ArrayList<>();
        int cursor = 0;

        for (SectionHint hint : hints) {
            String heading = hint.getHeading() != null && !hint.getHeading().isBlank()
                ? hint.getHeading().strip() : null;
            String body = hint.getBody() != null ? hint.getBody().strip() : "";
            if (body.isEmpty() && heading == null) {
                continue;
            }

            int start = body.isEmpty() ? -1 : text.indexOf(body, cursor);
            int end;
            if (start >= 0) {
                end = start + body.length();
                cursor = end;
            } else {
                // Extractor may have reflowed whitespace; keep a body-relative span
                start = 0;
                end = body.length();
            }

            clauses.add(createClause(versionId, clauses.size() + 1, heading, body, start, end));
        }
        return clauses;
    }

    private List<Clause> segmentParagraphs(String versionId, String text) {
        List<Clause> clauses = new ArrayList<>();
        Matcher matcher = BOUNDARY.matcher(text);
        int fragmentStart = 0;

        while (matcher.find()) {
            addFragment(versionId, text, fragmentStart, matcher.start(), clauses);
            fragmentStart = matcher.end();
        }
        addFragment(versionId, text, fragmentStart, text.length(), clauses);

        return clauses;
    }

    private void addFragment(String versionId, String text, int from, int to, List<Clause> clauses) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start == end) {
            return;
        }

        String fragment = text.substring(start, end);
        if (countWords(fragment) <= noiseWordThreshold) {
            log.trace("Dropping short fragment at {}: {}", start, fragment);
            return;
        }
        clauses.add(createClause(versionId, clauses.size() + 1, null, fragment, start, end));
    }

    private Clause createClause(String versionId, int number, String heading, String text, int start, int end) {
        return Clause.builder()
            .versionId(versionId)
            .number(number)
            .heading(heading)
            .category(classify(heading, text))
            .text(text)
            .spanStart(start)
            .spanEnd(end)
            .wordCount(countWords(text))
            .build();
    }

    /**
     * Pick the taxonomy category with the most keyword hits in heading + text.
     *
     * @return the best category, or null when no keyword matches
     */
    public ClauseCategory classify(String heading, String text) {
        String combined = ((heading != null ? heading : "") + " " + (text != null ? text : ""))
            .toLowerCase(Locale.ROOT);

        ClauseCategory best = null;
        int bestHits = 0;
        for (ClauseCategory category : ClauseCategory.values()) {
            int hits = 0;
            for (Pattern keyword : CATEGORY_PATTERNS.get(category)) {
                if (keyword.matcher(combined).find()) {
                    hits++;
                }
            }
            // strict '>' keeps the earlier category on ties
            if (hits > bestHits) {
                best = category;
                bestHits = hits;
            }
        }
        return best;
    }

    /**
     * Fold clauses shorter than {@code minWords} into the clause that follows them,
     * then renumber 1..n. A short trailing clause is folded into its predecessor,
     * so only a lone clause may stay under the minimum.
     */
    public List<Clause> mergeShortClauses(List<Clause> clauses, int minWords) {
        if (clauses == null || clauses.isEmpty()) {
            return List.of();
        }

        List<Clause> merged = new ArrayList<>();
        Clause current = clauses.get(0);

        for (Clause next : clauses.subList(1, clauses.size())) {
            if (current.getWordCount() < minWords) {
                current = absorb(current, next, next);
            } else {
                merged.add(current);
                current = next;
            }
        }

        if (current.getWordCount() < minWords && !merged.isEmpty()) {
            Clause previous = merged.remove(merged.size() - 1);
            current = absorb(previous, current, previous);
        }
        merged.add(current);

        List<Clause> renumbered = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            renumbered.add(merged.get(i).withNumber(i + 1));
        }

        if (renumbered.size() != clauses.size()) {
            log.debug("Merged {} clauses into {} (min words {})", clauses.size(), renumbered.size(), minWords);
        }
        return renumbered;
    }

    // first and second are adjacent in document order; the absorbing clause keeps its heading if it has one
    private Clause absorb(Clause first, Clause second, Clause absorbing) {
        Clause absorbed = absorbing == first ? second : first;
        String heading = absorbing.hasHeading() ? absorbing.getHeading() : absorbed.getHeading();
        String text = first.getText() + " " + second.getText();
        return first.toBuilder()
            .heading(heading)
            .text(text)
            .spanStart(Math.min(first.getSpanStart(), second.getSpanStart()))
            .spanEnd(Math.max(first.getSpanEnd(), second.getSpanEnd()))
            .wordCount(first.getWordCount() + second.getWordCount())
            .category(classify(heading, text))
            .build();
    }

    static int countWords(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
    }
}

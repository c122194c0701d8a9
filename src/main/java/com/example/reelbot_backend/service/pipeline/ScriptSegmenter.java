package com.example.reelbot_backend.service.pipeline;

import com.example.reelbot_backend.util.ClipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a testimonial script into a hook, one or more testimonial pieces and a call to action.
 * Durations are estimated from word count at a fixed speaking rate.
 */
@Component
public class ScriptSegmenter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptSegmenter.class);

    static final double WORDS_PER_SECOND = 2.5;
    static final int MAX_CHARS_PER_SEGMENT = 800;
    static final double MIN_SEGMENT_SECONDS = 2.0;
    static final int MAX_BODY_PIECES = 10;
    private static final int EDGE_SEGMENT_SECONDS = 5;
    private static final int EDGE_SENTENCE_MAX_CHARS = 150;
    private static final int CTA_MIN_CHARS = 20;
    private static final int CHARS_PER_WORD = 5;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+\\s*");
    private static final List<Pattern> HOOK_PATTERNS = List.of(
            Pattern.compile("^(.+?[!?])\\s+"),
            Pattern.compile("^(.+?\\.)\\s+")
    );
    private static final List<Pattern> CTA_PATTERNS = List.of(
            Pattern.compile("(.+?)([^.!?]*(?:try|check|visit|get|start|sign up|download|click|learn more|find out)[^.!?]*[.!?])\\s*$",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(.+?)([^.!?]*(?:today|now|for yourself)[^.!?]*[.!?])\\s*$", Pattern.CASE_INSENSITIVE)
    );

    public static double estimateDuration(String text) {
        return wordCount(text) / WORDS_PER_SECOND;
    }

    static int wordsForDuration(double seconds) {
        return (int) Math.round(seconds * WORDS_PER_SECOND);
    }

    /**
     * Strict segmentation. Testimonial text longer than {@code maxClipDuration} is split at sentence
     * boundaries into at most {@value #MAX_BODY_PIECES} pieces.
     */
    public SegmentationResult segment(String fullScript, int targetDuration, int maxClipDuration) {
        String clean = normalize(fullScript);
        LOGGER.debug("SEGMENT start chars={} target={}s maxClip={}s", clean.length(), targetDuration, maxClipDuration);

        String[] hookSplit = extractHook(clean);
        String[] ctaSplit = extractCta(hookSplit[1]);
        String hook = hookSplit[0];
        String cta = ctaSplit[0];
        String body = ctaSplit[1];

        List<ScriptSegment> segments = new ArrayList<>();
        segments.add(new ScriptSegment(ClipType.HOOK, hook, estimateDuration(hook), 1));
        double bodyDuration = estimateDuration(body);
        if (bodyDuration > maxClipDuration) {
            for (String piece : splitLongText(body, maxClipDuration)) {
                segments.add(new ScriptSegment(ClipType.TESTIMONIAL, piece, estimateDuration(piece), segments.size() + 1));
            }
        } else {
            segments.add(new ScriptSegment(ClipType.TESTIMONIAL, body, bodyDuration, 2));
        }
        segments.add(new ScriptSegment(ClipType.CTA, cta, estimateDuration(cta), segments.size() + 1));

        SegmentationResult result = toResult(segments);
        LOGGER.info("SEGMENT done clips={} totalDuration={}", result.clipCount(), String.format("%.1f", result.totalDuration()));
        return result;
    }

    /**
     * Coarse fallback: 20/60/20 split of the words into exactly three clips.
     */
    public SegmentationResult simpleSegment(String fullScript) {
        String clean = normalize(fullScript);
        String[] words = clean.isEmpty() ? new String[0] : WHITESPACE.split(clean);
        double total = words.length / WORDS_PER_SECOND;
        int hookWords = Math.max(1, wordsForDuration(total * 0.2));
        int ctaWords = Math.max(1, wordsForDuration(total * 0.2));
        if (hookWords + ctaWords >= words.length) {
            // too short for the ratio; keep at least one word in the body when possible
            hookWords = Math.min(1, words.length);
            ctaWords = words.length > 2 ? 1 : 0;
        }
        String hook = join(words, 0, hookWords);
        String body = join(words, hookWords, words.length - ctaWords);
        String cta = join(words, words.length - ctaWords, words.length);
        return toResult(List.of(
                new ScriptSegment(ClipType.HOOK, hook, total * 0.2, 1),
                new ScriptSegment(ClipType.TESTIMONIAL, body, total * 0.6, 2),
                new ScriptSegment(ClipType.CTA, cta, total * 0.2, 3)
        ));
    }

    public SegmentationResult.Validation validate(SegmentationResult result, int expectedClips, int maxClipDuration) {
        List<String> errors = new ArrayList<>();
        if (result.segments().isEmpty()) {
            errors.add("No segments generated");
        }
        Set<ClipType> seen = EnumSet.noneOf(ClipType.class);
        for (ScriptSegment s : result.segments()) {
            seen.add(s.type());
            if (s.content().isEmpty()) {
                errors.add("Empty content in " + s.type() + " segment " + s.order());
            }
            if (s.content().length() > MAX_CHARS_PER_SEGMENT) {
                errors.add(s.type() + " segment " + s.order() + " exceeds " + MAX_CHARS_PER_SEGMENT + " characters");
            }
            if (s.estimatedDuration() < MIN_SEGMENT_SECONDS) {
                errors.add(s.type() + " segment " + s.order() + " too short (< 2 seconds)");
            }
            if (s.estimatedDuration() > maxClipDuration * 1.5) {
                errors.add(s.type() + " segment " + s.order() + " too long (> " + maxClipDuration * 1.5 + " seconds)");
            }
        }
        for (ClipType required : ClipType.values()) {
            if (!seen.contains(required)) {
                errors.add("Missing " + required + " segment");
            }
        }
        if (result.segments().size() != expectedClips) {
            errors.add("Expected " + expectedClips + " clips but got " + result.segments().size());
        }
        return new SegmentationResult.Validation(errors.isEmpty(), errors);
    }

    private static String[] extractHook(String script) {
        for (Pattern p : HOOK_PATTERNS) {
            Matcher m = p.matcher(script);
            if (m.find() && m.group(1).length() < EDGE_SENTENCE_MAX_CHARS) {
                return new String[]{m.group(1).trim(), script.substring(m.end()).trim()};
            }
        }
        String[] words = splitWords(script);
        int n = Math.min(words.length, wordsForDuration(EDGE_SEGMENT_SECONDS));
        return new String[]{join(words, 0, n), join(words, n, words.length)};
    }

    private static String[] extractCta(String script) {
        for (Pattern p : CTA_PATTERNS) {
            Matcher m = p.matcher(script);
            if (m.find()) {
                String cta = m.group(2).trim();
                if (m.group(2).length() < EDGE_SENTENCE_MAX_CHARS && m.group(2).length() > CTA_MIN_CHARS) {
                    return new String[]{cta, m.group(1).trim()};
                }
            }
        }
        String[] words = splitWords(script);
        int n = Math.min(words.length, wordsForDuration(EDGE_SEGMENT_SECONDS));
        return new String[]{join(words, words.length - n, words.length), join(words, 0, words.length - n)};
    }

    private static List<String> splitLongText(String text, int maxClipDuration) {
        List<String> pieces = new ArrayList<>();
        String remaining = text;
        int targetChars = wordsForDuration(maxClipDuration) * CHARS_PER_WORD;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= targetChars * 1.2 || pieces.size() == MAX_BODY_PIECES - 1) {
                if (pieces.size() == MAX_BODY_PIECES - 1 && remaining.length() > targetChars * 1.2) {
                    LOGGER.warn("SEGMENT body exceeds {} pieces, last piece keeps {} chars", MAX_BODY_PIECES, remaining.length());
                }
                pieces.add(remaining);
                break;
            }
            int cut = closestBoundary(remaining, targetChars, targetChars * 0.2);
            String before = cut < 0 ? "" : remaining.substring(0, cut).trim();
            if (before.isEmpty()) {
                // no sentence end near the target, cut on words instead
                String[] words = splitWords(remaining);
                int n = Math.min(words.length, wordsForDuration(maxClipDuration));
                pieces.add(join(words, 0, n));
                remaining = join(words, n, words.length);
            } else {
                pieces.add(before);
                remaining = remaining.substring(cut).trim();
            }
        }
        return pieces;
    }

    /**
     * End offset of the sentence boundary nearest to {@code target}, or -1 when none lies within
     * {@code tolerance}.
     */
    private static int closestBoundary(String text, int target, double tolerance) {
        int closest = -1;
        double best = tolerance;
        Matcher m = SENTENCE_END.matcher(text);
        while (m.find()) {
            int distance = Math.abs(m.end() - target);
            if (distance < best) {
                best = distance;
                closest = m.end();
            }
        }
        return closest;
    }

    private static SegmentationResult toResult(List<ScriptSegment> segments) {
        double total = segments.stream().mapToDouble(ScriptSegment::estimatedDuration).sum();
        return new SegmentationResult(segments, total, segments.size());
    }

    private static String normalize(String script) {
        return script == null ? "" : WHITESPACE.matcher(script.trim()).replaceAll(" ");
    }

    public static int wordCount(String text) {
        String[] words = splitWords(text == null ? "" : text.trim());
        return words.length;
    }

    private static String[] splitWords(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.trim());
    }

    private static String join(String[] words, int from, int to) {
        if (from >= to) {
            return "";
        }
        return String.join(" ", Arrays.asList(words).subList(from, to));
    }
}

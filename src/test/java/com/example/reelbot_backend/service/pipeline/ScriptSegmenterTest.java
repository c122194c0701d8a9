package com.example.reelbot_backend.service.pipeline;

import com.example.reelbot_backend.util.ClipType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScriptSegmenterTest {

    private static final String PIZZA = "Best pizza in town! I ordered the margherita last Friday and it arrived hot and fresh. "
            + "The crust was perfect and the staff were friendly. Try it for yourself today.";

    private final ScriptSegmenter segmenter = new ScriptSegmenter();

    private static String joined(SegmentationResult result) {
        return result.segments().stream().map(ScriptSegment::content).collect(Collectors.joining(" "));
    }

    @Test
    void splitsHookTestimonialAndCallToAction() {
        SegmentationResult result = segmenter.segment(PIZZA, 30, 10);

        assertThat(result.clipCount()).isEqualTo(3);
        assertThat(result.segments()).extracting(ScriptSegment::type)
                .containsExactly(ClipType.HOOK, ClipType.TESTIMONIAL, ClipType.CTA);
        assertThat(result.segments()).extracting(ScriptSegment::order).containsExactly(1, 2, 3);
        assertThat(result.segments().get(0).content()).isEqualTo("Best pizza in town!");
        assertThat(result.segments().get(2).content()).isEqualTo("Try it for yourself today.");
        assertThat(joined(result)).isEqualTo(PIZZA);
    }

    @Test
    void longTestimonialIsSplitAtSentenceBoundaries() {
        String sentence = "The team handled every detail of our kitchen remodel with care. ";
        String script = "We love this contractor! " + sentence.repeat(8) + "Visit their showroom and get a quote today.";

        SegmentationResult result = segmenter.segment(script, 60, 10);

        List<ScriptSegment> body = result.segments().subList(1, result.clipCount() - 1);
        assertThat(body).hasSizeGreaterThan(1).allMatch(s -> s.type() == ClipType.TESTIMONIAL);
        assertThat(body).allMatch(s -> s.content().endsWith("."));
        assertThat(result.segments()).extracting(ScriptSegment::order)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, result.clipCount()).boxed().toList());
        assertThat(joined(result)).isEqualTo(script.trim());
    }

    @Test
    void unpunctuatedBodyIsCutOnWordsAndCappedAtTenPieces() {
        String script = IntStream.range(0, 400).mapToObj(i -> "word" + i).collect(Collectors.joining(" "));

        SegmentationResult result = segmenter.segment(script, 120, 2);

        assertThat(result.clipCount()).isEqualTo(1 + ScriptSegmenter.MAX_BODY_PIECES + 1);
        assertThat(result.segments().get(0).type()).isEqualTo(ClipType.HOOK);
        assertThat(result.segments().get(result.clipCount() - 1).type()).isEqualTo(ClipType.CTA);
        assertThat(result.segments().get(1).content().split(" ")).hasSize(5);
        assertThat(joined(result)).isEqualTo(script);
    }

    @Test
    void simpleSegmentUsesTwentySixtyTwentySplit() {
        SegmentationResult result = segmenter.simpleSegment("one two three four five six seven eight nine ten");

        assertThat(result.segments()).extracting(ScriptSegment::content)
                .containsExactly("one two", "three four five six seven eight", "nine ten");
        assertThat(result.totalDuration()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void simpleSegmentKeepsTinyScriptsInThreeClips() {
        SegmentationResult result = segmenter.simpleSegment("Hello world");

        assertThat(result.clipCount()).isEqualTo(3);
        assertThat(result.segments().get(0).content()).isEqualTo("Hello");
        assertThat(result.segments().get(1).content()).isEqualTo("world");
    }

    @Test
    void validationReportsEveryProblem() {
        SegmentationResult result = new SegmentationResult(List.of(
                new ScriptSegment(ClipType.HOOK, "Hi!", 0.4, 1),
                new ScriptSegment(ClipType.TESTIMONIAL, "x".repeat(900), 20.0, 2)
        ), 20.4, 2);

        SegmentationResult.Validation validation = segmenter.validate(result, 3, 10);

        assertThat(validation.valid()).isFalse();
        assertThat(validation.errors()).anyMatch(e -> e.contains("too short"))
                .anyMatch(e -> e.contains("800 characters"))
                .anyMatch(e -> e.contains("too long"))
                .anyMatch(e -> e.contains("Missing CTA"))
                .anyMatch(e -> e.contains("Expected 3 clips"));
    }

    @Test
    void wellFormedSegmentationValidates() {
        SegmentationResult result = new SegmentationResult(List.of(
                new ScriptSegment(ClipType.HOOK, "You have to see this!", 3.0, 1),
                new ScriptSegment(ClipType.TESTIMONIAL, "Fast delivery and friendly people.", 6.0, 2),
                new ScriptSegment(ClipType.CTA, "Order yours today.", 3.0, 3)
        ), 12.0, 3);

        assertThat(segmenter.validate(result, 3, 10).valid()).isTrue();
    }

    @Test
    void durationFollowsSpeakingRate() {
        assertThat(ScriptSegmenter.estimateDuration("one two three four five")).isEqualTo(2.0);
        assertThat(ScriptSegmenter.wordCount("  spaced   out  words ")).isEqualTo(3);
        assertThat(ScriptSegmenter.wordCount(null)).isZero();
    }
}

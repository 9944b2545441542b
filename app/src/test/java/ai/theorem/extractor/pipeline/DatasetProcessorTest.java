package ai.theorem.extractor.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import ai.theorem.extractor.extract.TheoremExtractor;
import ai.theorem.extractor.extract.TheoremSpan;
import ai.theorem.extractor.oracle.PassThroughQualityOracle;
import ai.theorem.extractor.oracle.QualityCheckService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DatasetProcessorTest {

    private final QualityCheckService qualityCheckService = new QualityCheckService(new PassThroughQualityOracle());

    @AfterEach
    void closeService() {
        qualityCheckService.close();
    }

    @Test
    void failingPaperIsRecordedAndOthersContinue() {
        TheoremExtractor explodingExtractor = new TheoremExtractor() {
            @Override
            public List<TheoremSpan> extract(String workingText) {
                if (workingText.contains("BOOM")) {
                    throw new IllegalStateException("cannot parse");
                }
                return super.extract(workingText);
            }
        };
        DatasetProcessor processor = new DatasetProcessor(
                new PaperPipeline(explodingExtractor, qualityCheckService, true), 42L, 0);

        DatasetRunResult result = processor.process(List.of(
                Paper.of("bad", "BOOM \\begin{theorem} A. \\end{theorem}"),
                Paper.of("good", "Intro. \\begin{theorem} B. \\end{theorem}")));

        assertThat(result.failedPapers()).containsExactly("bad");
        assertThat(result.papersProcessed()).isEqualTo(2);
        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.paperLink()).isEqualTo("good");
            assertThat(record.theorem()).isEqualTo("B.");
        });
    }

    @Test
    void dropsRepeatedLinksInShuffledOrderAndNamesUnlinkedByPosition() {
        List<Paper> papers = List.of(
                Paper.of("a", "1"),
                Paper.of(null, "2"),
                Paper.of("a", "3"),
                Paper.of(" ", "4"));
        List<Paper> shuffled = new ArrayList<>(papers);
        Collections.shuffle(shuffled, new Random(42L));
        String firstA = shuffled.stream()
                .filter(paper -> paper.paperLink().isPresent())
                .findFirst()
                .orElseThrow()
                .fullText();

        List<Paper> selected = processor(0).selectPapers(papers);

        assertThat(selected).hasSize(3);
        assertThat(selected)
                .filteredOn(paper -> paper.paperLink().orElseThrow().equals("a"))
                .singleElement()
                .satisfies(paper -> assertThat(paper.fullText()).isEqualTo(firstA));
        for (int i = 0; i < selected.size(); i++) {
            Paper paper = selected.get(i);
            if (!paper.paperLink().orElseThrow().equals("a")) {
                assertThat(paper.paperLink()).contains("paper_" + i);
            }
        }
    }

    @Test
    void unlinkedPapersAreNamedAfterSampling() {
        List<Paper> papers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            papers.add(Paper.of(null, "text " + i));
        }

        assertThat(processor(2).selectPapers(papers))
                .extracting(paper -> paper.paperLink().orElseThrow())
                .containsExactly("paper_0", "paper_1");
    }

    @Test
    void shufflesWithSeedAndSamples() {
        List<Paper> papers = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            papers.add(Paper.of("p" + i, "text " + i));
        }
        List<Paper> expected = new ArrayList<>(papers);
        Collections.shuffle(expected, new Random(42L));

        assertThat(processor(0).selectPapers(papers)).containsExactlyElementsOf(expected);
        assertThat(processor(3).selectPapers(papers)).containsExactlyElementsOf(expected.subList(0, 3));
    }

    @Test
    void dropsRecordsWithRepeatedContextAndNumbersTheRest() {
        String shared = "Same intro. \\begin{theorem}[1] A. \\end{theorem}";
        DatasetProcessor processor = processor(0);

        DatasetRunResult result = processor.process(List.of(
                Paper.of("x", shared),
                Paper.of("y", shared),
                Paper.of("z", "Other intro. \\begin{theorem} C. \\end{theorem} more \\begin{theorem} D. \\end{theorem}")));

        assertThat(result.totalSpans()).isEqualTo(4);
        assertThat(result.keptSpans()).isEqualTo(4);
        assertThat(result.duplicateContextsRemoved()).isEqualTo(1);
        assertThat(result.records()).hasSize(3);
        assertThat(result.records()).extracting(TheoremRecord::id).containsExactly(0, 1, 2);
        assertThat(result.records()).extracting(TheoremRecord::context).doesNotHaveDuplicates();
    }

    @Test
    void emptyInputGivesEmptyResult() {
        assertThat(processor(0).process(List.of())).isEqualTo(DatasetRunResult.empty());
    }

    private DatasetProcessor processor(int sampleLimit) {
        return new DatasetProcessor(new PaperPipeline(new TheoremExtractor(), qualityCheckService, true), 42L, sampleLimit);
    }
}

package ai.dualpdf.translator.pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationHighlight;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PageMergeEngineTest {

    @TempDir
    Path tempDir;

    private final PageMergeEngine engine = new PageMergeEngine();

    @Test
    void mergeDoublesWidthAndKeepsHeight() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 3);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 3);

        MergeResult result = engine.merge(left, right, 0.0, tempDir.resolve("merged.pdf"));

        assertThat(result.pages()).isEqualTo(3);
        assertThat(result.pageSizes()).containsOnly(new PageSize(1190.0, 842.0));
        assertThat(PageGeometry.read(result.output())).hasSize(3).containsOnly(new PageSize(1190.0, 842.0));
    }

    @Test
    void mergeAddsGapBetweenHalves() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 2);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 2);

        MergeResult result = engine.merge(left, right, 20.0, tempDir.resolve("merged.pdf"));

        assertThat(result.pageSizes()).containsOnly(new PageSize(1210.0, 842.0));
    }

    @Test
    void mergeKeepsPerPageGeometryOfLeftDocument() throws Exception {
        List<PageSize> sizes = List.of(PdfFixtures.A4, new PageSize(612.0, 792.0));
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), sizes);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 2);

        MergeResult result = engine.merge(left, right, 0.0, tempDir.resolve("merged.pdf"));

        assertThat(result.pageSizes()).containsExactly(new PageSize(1190.0, 842.0), new PageSize(1224.0, 792.0));
    }

    @Test
    void mergeRejectsDifferentPageCounts() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 3);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 2);
        Path output = tempDir.resolve("merged.pdf");

        assertThatThrownBy(() -> engine.merge(left, right, 0.0, output))
                .isInstanceOf(PageCountMismatchException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void mergeRejectsNegativeGapAndOverwritingInput() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 1);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 1);

        assertThatThrownBy(() -> engine.merge(left, right, -1.0, tempDir.resolve("merged.pdf")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.merge(left, right, 0.0, left))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void splitRestoresOriginalWidth() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 2);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 2);
        Path merged = engine.merge(left, right, 0.0, tempDir.resolve("merged.pdf")).output();

        MergeResult split = engine.split(merged, tempDir.resolve("split.pdf"));

        assertThat(split.pages()).isEqualTo(2);
        assertThat(PageGeometry.read(split.output())).containsOnly(PdfFixtures.A4);
        assertThat(Files.size(merged)).isPositive();
    }

    @Test
    void splitHonoursGap() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 1);
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 1);
        Path merged = engine.merge(left, right, 30.0, tempDir.resolve("merged.pdf")).output();

        MergeResult split = engine.split(merged, 30.0, tempDir.resolve("split.pdf"));

        assertThat(split.pageSizes()).containsExactly(PdfFixtures.A4);
    }

    @Test
    void splitRejectsGapWiderThanPage() throws Exception {
        Path single = PdfFixtures.create(tempDir.resolve("single.pdf"), 1, new PageSize(100.0, 100.0));

        assertThatThrownBy(() -> engine.split(single, 150.0, tempDir.resolve("split.pdf")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeAndSplitUseVisibleCropBox() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 1, new PageSize(612.0, 792.0));
        try (PDDocument document = PdfDocuments.open(left)) {
            document.getPage(0).setCropBox(new PDRectangle(50, 50, 500, 700));
            PdfDocuments.saveCompacted(document, tempDir.resolve("cropped.pdf"));
        }
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 1, new PageSize(500.0, 700.0));

        MergeResult merged = engine.merge(tempDir.resolve("cropped.pdf"), right, 0.0, tempDir.resolve("merged.pdf"));
        MergeResult split = engine.split(merged.output(), tempDir.resolve("split.pdf"));

        assertThat(merged.pageSizes()).containsExactly(new PageSize(1000.0, 700.0));
        try (PDDocument document = PdfDocuments.open(merged.output())) {
            PDRectangle crop = document.getPage(0).getCropBox();
            assertThat(crop.getLowerLeftX()).isEqualTo(50f);
            assertThat(crop.getLowerLeftY()).isEqualTo(50f);
            assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(1000f);
        }
        assertThat(split.pageSizes()).containsExactly(new PageSize(500.0, 700.0));
        try (PDDocument document = PdfDocuments.open(split.output())) {
            assertThat(document.getPage(0).getCropBox().getLowerLeftX()).isEqualTo(50f);
        }
    }

    @Test
    void mergeThenSplitKeepsLeftAnnotations() throws Exception {
        Path left = PdfFixtures.create(tempDir.resolve("left.pdf"), 2);
        Path annotated = annotate(left, tempDir.resolve("annotated.pdf"));
        Path right = PdfFixtures.create(tempDir.resolve("right.pdf"), 2);
        List<List<String>> before = annotationRectangles(annotated);

        Path merged = engine.merge(annotated, right, 0.0, tempDir.resolve("merged.pdf")).output();
        Path split = engine.split(merged, tempDir.resolve("split.pdf")).output();

        assertThat(before).allSatisfy(page -> assertThat(page).hasSize(2));
        assertThat(annotationRectangles(merged)).isEqualTo(before);
        assertThat(annotationRectangles(split)).isEqualTo(before);
        assertThat(PageGeometry.read(split)).containsOnly(PdfFixtures.A4);
    }

    private static Path annotate(Path source, Path target) throws IOException {
        try (PDDocument document = PdfDocuments.open(source)) {
            for (PDPage page : document.getPages()) {
                PDAnnotationLink link = new PDAnnotationLink();
                link.setRectangle(new PDRectangle(40, 760, 180, 20));
                PDActionURI action = new PDActionURI();
                action.setURI("https://doi.org/10.1000/example");
                link.setAction(action);

                PDAnnotationHighlight highlight = new PDAnnotationHighlight();
                highlight.setRectangle(new PDRectangle(38, 778, 120, 16));
                highlight.setQuadPoints(new float[] {38, 794, 158, 794, 38, 778, 158, 778});

                List<PDAnnotation> annotations = page.getAnnotations();
                annotations.add(link);
                annotations.add(highlight);
                page.setAnnotations(annotations);
            }
            PdfDocuments.saveCompacted(document, target);
        }
        return target;
    }

    private static List<List<String>> annotationRectangles(Path pdf) throws IOException {
        List<List<String>> pages = new ArrayList<>();
        try (PDDocument document = PdfDocuments.open(pdf)) {
            for (PDPage page : document.getPages()) {
                List<String> rectangles = new ArrayList<>();
                for (PDAnnotation annotation : page.getAnnotations()) {
                    rectangles.add(annotation.getSubtype() + annotation.getRectangle());
                }
                pages.add(rectangles);
            }
        }
        return pages;
    }
}

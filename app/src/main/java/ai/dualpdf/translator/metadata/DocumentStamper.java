package ai.dualpdf.translator.metadata;

import ai.dualpdf.translator.pdf.PdfDocuments;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import ai.dualpdf.translator.writer.CommitResult;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Calendar;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.common.filespecification.PDComplexFileSpecification;
import org.apache.pdfbox.pdmodel.common.filespecification.PDEmbeddedFile;
import org.apache.pdfbox.pdmodel.common.filespecification.PDFileSpecification;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationFileAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the metadata marker, and optionally a clickable link to the original document, into a PDF.
 */
public class DocumentStamper {

    public static final String BACK_REFERENCE_TITLE = "Original PDF";
    static final float MARGIN = 8f;
    static final float TAG_WIDTH = 140f;
    static final float TAG_HEIGHT = 26f;

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStamper.class);

    private final MetadataManager metadataManager;
    private final AtomicFileTransaction transaction;

    public DocumentStamper(MetadataManager metadataManager, AtomicFileTransaction transaction) {
        this.metadataManager = Objects.requireNonNull(metadataManager, "metadataManager");
        this.transaction = Objects.requireNonNull(transaction, "transaction");
    }

    /**
     * Stamps {@code pdf} and commits the result over it, falling back to a {@code .pdf2zh-updated.pdf} sidecar.
     * Nothing is written when the document already carries everything requested.
     */
    public StampResult stampInPlace(Path pdf, TranslationMetadata metadata, Optional<Path> backReference)
            throws IOException {
        Path temporary = SidecarPaths.temporaryFor(pdf);
        StampResult result;
        try (PDDocument document = PdfDocuments.open(pdf)) {
            result = apply(document, metadata, backReference);
            if (!result.changed()) {
                return result;
            }
            PdfDocuments.saveCompacted(document, temporary);
        }
        CommitResult commit = transaction.commitOrSidecar(temporary, pdf, SidecarPaths.UPDATED_SIDECAR_SUFFIX);
        return new StampResult(result.metadata(), result.backReferenceAdded(), result.attachmentFailure(),
                Optional.of(commit));
    }

    /**
     * Stamps {@code source} and always saves the outcome to {@code target}; {@code source} is not modified.
     */
    public StampResult stampInto(Path source, Path target, TranslationMetadata metadata,
                                 Optional<Path> backReference) throws IOException {
        try (PDDocument document = PdfDocuments.open(source)) {
            StampResult result = apply(document, metadata, backReference);
            PdfDocuments.saveCompacted(document, target);
            return result;
        }
    }

    private StampResult apply(PDDocument document, TranslationMetadata metadata, Optional<Path> backReference)
            throws IOException {
        EmbedResult embedded = metadataManager.embed(document, metadata);
        boolean added = false;
        Optional<String> failure = Optional.empty();
        if (backReference.isPresent()) {
            try {
                added = attachBackReference(document, backReference.get());
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Could not attach original {}: {}", backReference.get().getFileName(), ex.getMessage());
                failure = Optional.of(String.valueOf(ex.getMessage()));
            }
        }
        return new StampResult(embedded, added, failure, Optional.empty());
    }

    /**
     * Adds a file-attachment annotation carrying {@code original} to the top-left corner of the first page.
     *
     * @return {@code false} when the document has no pages or already links to a file of the same name
     */
    boolean attachBackReference(PDDocument document, Path original) throws IOException {
        if (document.getNumberOfPages() == 0) {
            return false;
        }
        String fileName = original.getFileName().toString();
        PDPage page = document.getPage(0);
        List<PDAnnotation> annotations = page.getAnnotations();
        for (PDAnnotation annotation : annotations) {
            if (annotation instanceof PDAnnotationFileAttachment && linksTo((PDAnnotationFileAttachment) annotation, fileName)) {
                return false;
            }
        }

        byte[] bytes = Files.readAllBytes(original);
        PDEmbeddedFile embeddedFile = new PDEmbeddedFile(document, new ByteArrayInputStream(bytes));
        embeddedFile.setSubtype("application/pdf");
        embeddedFile.setSize(bytes.length);
        embeddedFile.setCreationDate(Calendar.getInstance());

        PDComplexFileSpecification specification = new PDComplexFileSpecification();
        specification.setFile(fileName);
        specification.setFileUnicode(fileName);
        specification.setFileDescription("Open the original PDF: " + fileName);
        specification.setEmbeddedFile(embeddedFile);
        specification.setEmbeddedFileUnicode(embeddedFile);

        PDRectangle crop = page.getCropBox();
        float left = crop.getLowerLeftX() + MARGIN;
        float top = crop.getUpperRightY() - MARGIN;

        PDAnnotationFileAttachment annotation = new PDAnnotationFileAttachment();
        annotation.setRectangle(new PDRectangle(left, top - TAG_HEIGHT, TAG_WIDTH, TAG_HEIGHT));
        annotation.setAttachmentName(PDAnnotationFileAttachment.ATTACHMENT_NAME_PUSH_PIN);
        annotation.setFile(specification);
        annotation.setTitlePopup(BACK_REFERENCE_TITLE);
        annotation.setContents("Open original (" + fileName + ")");
        annotation.setModifiedDate(Calendar.getInstance());
        try {
            annotation.constructAppearances(document);
        } catch (RuntimeException ex) {
            LOGGER.debug("No appearance stream for back reference: {}", ex.getMessage());
        }
        annotations.add(annotation);
        page.setAnnotations(annotations);
        return true;
    }

    private static boolean linksTo(PDAnnotationFileAttachment annotation, String fileName) throws IOException {
        PDFileSpecification file = annotation.getFile();
        if (file != null && fileName.equals(file.getFile())) {
            return true;
        }
        if (file instanceof PDComplexFileSpecification
                && fileName.equals(((PDComplexFileSpecification) file).getFileUnicode())) {
            return true;
        }
        String contents = annotation.getContents();
        return BACK_REFERENCE_TITLE.equals(annotation.getTitlePopup()) && contents != null && contents.contains(fileName);
    }
}

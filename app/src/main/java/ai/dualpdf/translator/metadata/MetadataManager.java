package ai.dualpdf.translator.metadata;

import ai.dualpdf.translator.pdf.PageSize;
import ai.dualpdf.translator.pdf.PdfDocuments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentNameDictionary;
import org.apache.pdfbox.pdmodel.PDEmbeddedFilesNameTreeNode;
import org.apache.pdfbox.pdmodel.common.PDNameTreeNode;
import org.apache.pdfbox.pdmodel.common.filespecification.PDComplexFileSpecification;
import org.apache.pdfbox.pdmodel.common.filespecification.PDEmbeddedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the JSON marker that records whether a document has been translated. The marker lives in
 * the document's embedded-files name tree under a single canonical name.
 */
public class MetadataManager {

    public static final String CANONICAL_NAME = "pdf2zh.meta.json";
    public static final String DESCRIPTION = "PDF2ZH metadata";

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataManager.class);
    private static final String LEGACY_PREFIX = "pdf2zh.";
    private static final String LEGACY_OBJECT = "pdf2zh";
    private static final COSName AF = COSName.getPDFName("AF");
    private static final COSName AF_RELATIONSHIP = COSName.getPDFName("AFRelationship");
    private static final COSName DATA = COSName.getPDFName("Data");
    private static final COSName UNICODE_FILE = COSName.getPDFName("UF");

    private final ObjectMapper objectMapper;

    public MetadataManager() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public MetadataManager(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Embeds the marker unless one is already present under the canonical name. A {@code translated} marker
     * supersedes any other existing marker.
     */
    public EmbedResult embed(PDDocument document, TranslationMetadata metadata) throws IOException {
        if (findSpecification(document) != null
                && (metadata.status() != MetadataStatus.TRANSLATED || read(document).isTranslated())) {
            return EmbedResult.ALREADY_EXISTS;
        }
        byte[] json = toJson(metadata);

        PDEmbeddedFile embeddedFile = new PDEmbeddedFile(document, new ByteArrayInputStream(json));
        embeddedFile.setSubtype("application/json");
        embeddedFile.setSize(json.length);
        embeddedFile.setCreationDate(Calendar.getInstance());

        PDComplexFileSpecification specification = new PDComplexFileSpecification();
        specification.setFile(CANONICAL_NAME);
        specification.setFileUnicode(CANONICAL_NAME);
        specification.setFileDescription(DESCRIPTION);
        specification.setEmbeddedFile(embeddedFile);
        specification.setEmbeddedFileUnicode(embeddedFile);

        PDDocumentCatalog catalog = document.getDocumentCatalog();
        PDDocumentNameDictionary names = catalog.getNames();
        if (names == null) {
            names = new PDDocumentNameDictionary(catalog);
            catalog.setNames(names);
        }
        Map<String, PDComplexFileSpecification> entries = new LinkedHashMap<>();
        PDEmbeddedFilesNameTreeNode existing = names.getEmbeddedFiles();
        if (existing != null) {
            collect(existing, entries);
        }
        entries.put(CANONICAL_NAME, specification);
        PDEmbeddedFilesNameTreeNode tree = new PDEmbeddedFilesNameTreeNode();
        tree.setNames(entries);
        names.setEmbeddedFiles(tree);

        registerAssociatedFile(catalog, specification);
        return EmbedResult.EMBEDDED;
    }

    public MetadataReadResult read(Path pdf) throws IOException {
        try (PDDocument document = PdfDocuments.open(pdf)) {
            return read(document);
        }
    }

    public MetadataReadResult read(PDDocument document) throws IOException {
        PDComplexFileSpecification specification = findSpecification(document);
        if (specification == null) {
            return MetadataReadResult.of(MetadataReadResult.Outcome.NO_METADATA_FOUND);
        }
        PDEmbeddedFile embeddedFile = specification.getEmbeddedFileUnicode() != null
                ? specification.getEmbeddedFileUnicode()
                : specification.getEmbeddedFile();
        if (embeddedFile == null) {
            return MetadataReadResult.of(MetadataReadResult.Outcome.METADATA_EMPTY);
        }
        byte[] content = embeddedFile.toByteArray();
        if (content.length == 0) {
            return MetadataReadResult.of(MetadataReadResult.Outcome.METADATA_EMPTY);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Metadata attachment is not valid JSON: {}", ex.getOriginalMessage());
            return new MetadataReadResult(MetadataReadResult.Outcome.METADATA_PARSE_ERROR, ex.getOriginalMessage(),
                    OptionalDouble.empty());
        }
        if (root == null || !root.isObject()) {
            return MetadataReadResult.of(MetadataReadResult.Outcome.METADATA_PARSE_ERROR);
        }

        String status = field(root, "status").map(JsonNode::asText).orElse("");
        OptionalDouble gap = field(root, "gap_pt")
                .filter(JsonNode::isNumber)
                .map(node -> OptionalDouble.of(node.asDouble()))
                .orElse(OptionalDouble.empty());
        if (MetadataStatus.TRANSLATED.wireValue().equals(status)) {
            return new MetadataReadResult(MetadataReadResult.Outcome.TRANSLATED, "", gap);
        }
        if (MetadataStatus.UNTRANSLATED.wireValue().equals(status)) {
            return new MetadataReadResult(MetadataReadResult.Outcome.UNTRANSLATED, "", gap);
        }
        return new MetadataReadResult(MetadataReadResult.Outcome.UNKNOWN_STATUS, status, gap);
    }

    public boolean hasMetadata(PDDocument document) throws IOException {
        return findSpecification(document) != null;
    }

    /**
     * Estimates the gap that was inserted between the halves of a merged document from page widths alone.
     */
    public static double inferGap(List<PageSize> source, List<PageSize> result) {
        int pages = Math.min(source.size(), result.size());
        List<Double> candidates = new ArrayList<>();
        for (int i = 0; i < pages; i++) {
            double candidate = round2(result.get(i).w() - 2 * source.get(i).w());
            if (candidate < -0.5) {
                continue;
            }
            candidates.add(Math.max(0.0, candidate));
        }
        if (candidates.isEmpty()) {
            return 0.0;
        }
        return round2(median(candidates));
    }

    byte[] toJson(TranslationMetadata metadata) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("status", metadata.status().wireValue());
        root.put("run_time_utc", DateTimeFormatter.ISO_INSTANT.format(metadata.runTime()));
        if (metadata.status() == MetadataStatus.TRANSLATED) {
            metadata.model().ifPresent(model -> root.put("model", model));
            root.set("source_page_sizes_pt", sizes(metadata.sourcePageSizes()));
            root.put("gap_pt", metadata.gapPt());
            if (!metadata.resultPageSizes().isEmpty()) {
                root.set("result_page_sizes_pt", sizes(metadata.resultPageSizes()));
            }
        }
        return objectMapper.writeValueAsBytes(root);
    }

    private ArrayNode sizes(List<PageSize> sizes) {
        ArrayNode array = objectMapper.createArrayNode();
        for (PageSize size : sizes) {
            ObjectNode node = array.addObject();
            node.put("w", size.w());
            node.put("h", size.h());
        }
        return array;
    }

    private static Optional<JsonNode> field(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null) {
            value = root.get(LEGACY_PREFIX + key);
        }
        if (value == null && root.path(LEGACY_OBJECT).isObject()) {
            value = root.path(LEGACY_OBJECT).get(key);
        }
        return Optional.ofNullable(value).filter(node -> !node.isNull());
    }

    private static PDComplexFileSpecification findSpecification(PDDocument document) throws IOException {
        PDDocumentNameDictionary names = document.getDocumentCatalog().getNames();
        if (names == null || names.getEmbeddedFiles() == null) {
            return null;
        }
        Map<String, PDComplexFileSpecification> entries = new LinkedHashMap<>();
        collect(names.getEmbeddedFiles(), entries);
        return entries.get(CANONICAL_NAME);
    }

    private static void collect(PDNameTreeNode<PDComplexFileSpecification> node,
                                Map<String, PDComplexFileSpecification> into) throws IOException {
        Map<String, PDComplexFileSpecification> leaves = node.getNames();
        if (leaves != null) {
            into.putAll(leaves);
        }
        List<PDNameTreeNode<PDComplexFileSpecification>> kids = node.getKids();
        if (kids != null) {
            for (PDNameTreeNode<PDComplexFileSpecification> kid : kids) {
                collect(kid, into);
            }
        }
    }

    private static void registerAssociatedFile(PDDocumentCatalog catalog, PDComplexFileSpecification specification) {
        try {
            specification.getCOSObject().setItem(AF_RELATIONSHIP, DATA);
            COSDictionary catalogDictionary = catalog.getCOSObject();
            COSArray associated = catalogDictionary.getCOSArray(AF);
            if (associated == null) {
                associated = new COSArray();
                catalogDictionary.setItem(AF, associated);
            }
            for (int i = associated.size() - 1; i >= 0; i--) {
                COSBase entry = associated.getObject(i);
                if (entry instanceof COSDictionary && isCanonical((COSDictionary) entry)) {
                    associated.remove(i);
                }
            }
            associated.add(specification);
        } catch (RuntimeException ex) {
            LOGGER.debug("Could not register metadata as associated file: {}", ex.getMessage());
        }
    }

    private static boolean isCanonical(COSDictionary fileSpecification) {
        return CANONICAL_NAME.equals(fileSpecification.getString(COSName.F))
                || CANONICAL_NAME.equals(fileSpecification.getString(UNICODE_FILE));
    }

    private static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 1) {
            return sorted.get(size / 2);
        }
        return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

package com.example.filesearch;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Extracts document properties and the text of the leading pages of a PDF.
 * <p>
 * The text starts with one {@code key: value} line per present property (title, author, subject, producer,
 * creator) plus {@code page_count}, followed by a blank line and a {@code --- Page N ---} block for every
 * extracted page that has text. Only the first {@code scanner.pdf.max.pages} pages are read; 0 reads all.
 */
@Slf4j
@Component
public class PdfContentExtractor implements ContentExtractor {

    private final long maxSizeBytes;
    private final int maxPages;

    public PdfContentExtractor(@Value("${scanner.max.file.size.mb:50}") long maxSizeMb,
                               @Value("${scanner.pdf.max.pages:1}") int maxPages) {
        this.maxSizeBytes = maxSizeMb * 1024 * 1024;
        this.maxPages = Math.max(0, maxPages);
    }

    @Override
    public boolean supports(Path file) {
        return "pdf".equals(PlainTextContentExtractor.extensionOf(file));
    }

    @Override
    public ExtractedContent extract(Path file) throws ExtractionException {
        if (!Files.exists(file)) throw new ContentNotFoundException(file);
        if (!supports(file)) throw new UnsupportedContentTypeException(file);
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            if (maxSizeBytes > 0 && attrs.size() > maxSizeBytes) {
                throw new ExtractionException(file, String.format(Locale.ROOT, "File too large (%.2fMB). Maximum size: %dMB",
                        attrs.size() / (1024.0 * 1024.0), maxSizeBytes / (1024 * 1024)));
            }
            try (PDDocument doc = Loader.loadPDF(file.toFile())) {
                int pageCount = doc.getNumberOfPages();
                String text = properties(doc, pageCount) + "\n\n" + pageText(doc, pageCount);
                FileMetadata metadata = new FileMetadata(
                        file.toAbsolutePath().normalize().toString(),
                        file.getFileName().toString(),
                        "pdf",
                        attrs.size(),
                        attrs.creationTime().toInstant(),
                        attrs.lastModifiedTime().toInstant(),
                        pageCount);
                log.debug("Extracted {} of {} pages from {}", Math.min(pageCount, maxPages == 0 ? pageCount : maxPages), pageCount, file);
                return new ExtractedContent(metadata, text.strip());
            }
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(file);
        } catch (IOException e) {
            throw new ExtractionException(file, "Error processing PDF file '" + file + "': " + e.getMessage(), e);
        }
    }

    private static String properties(PDDocument doc, int pageCount) {
        PDDocumentInformation info = doc.getDocumentInformation();
        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", info.getTitle());
        props.put("author", info.getAuthor());
        props.put("subject", info.getSubject());
        props.put("producer", info.getProducer());
        props.put("creator", info.getCreator());
        props.put("page_count", String.valueOf(pageCount));
        return props.entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().isBlank())
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    private String pageText(PDDocument doc, int pageCount) throws IOException {
        int last = maxPages == 0 ? pageCount : Math.min(pageCount, maxPages);
        PDFTextStripper stripper = new PDFTextStripper();
        StringBuilder out = new StringBuilder();
        for (int page = 1; page <= last; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String text = stripper.getText(doc).strip();
            if (text.isEmpty()) continue;
            out.append("--- Page ").append(page).append(" ---\n").append(text).append('\n');
        }
        return out.toString();
    }
}

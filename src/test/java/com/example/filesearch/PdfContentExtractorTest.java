package com.example.filesearch;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PdfContentExtractorTest {

    @TempDir
    Path tempDir;

    static Path writePdf(Path file, String title, String author, String... pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String body : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(body);
                    content.endText();
                }
            }
            if (title != null) doc.getDocumentInformation().setTitle(title);
            if (author != null) doc.getDocumentInformation().setAuthor(author);
            doc.save(file.toFile());
        }
        return file;
    }

    @Test
    public void extractsPropertiesAndFirstPage() throws Exception {
        Path pdf = writePdf(tempDir.resolve("Report.PDF"), "Quarterly Report", "Dana Lee",
                "first page body", "second page body");

        ExtractedContent content = new PdfContentExtractor(50, 1).extract(pdf);

        assertThat(content.extractedText())
                .startsWith("title: Quarterly Report\nauthor: Dana Lee")
                .contains("page_count: 2")
                .contains("--- Page 1 ---\nfirst page body")
                .doesNotContain("second page body");
        assertThat(content.metadata().pageCount()).isEqualTo(2);
        assertThat(content.metadata().fileType()).isEqualTo("pdf");
        assertThat(content.metadata().filename()).isEqualTo("Report.PDF");
        assertThat(content.metadata().sizeBytes()).isEqualTo(Files.size(pdf));
    }

    @Test
    public void zeroPageLimitReadsEveryPage() throws Exception {
        Path pdf = writePdf(tempDir.resolve("all.pdf"), null, null, "alpha page", "beta page");

        String text = new PdfContentExtractor(50, 0).extract(pdf).extractedText();

        assertThat(text).startsWith("page_count: 2").doesNotContain("title:");
        assertThat(text).contains("--- Page 1 ---\nalpha page").contains("--- Page 2 ---\nbeta page");
    }

    @Test
    public void missingFileIsContentNotFound() {
        assertThatThrownBy(() -> new PdfContentExtractor(50, 1).extract(tempDir.resolve("gone.pdf")))
                .isInstanceOf(ContentNotFoundException.class);
    }

    @Test
    public void unreadablePdfIsExtractionFailure() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not really a pdf");

        assertThatThrownBy(() -> new PdfContentExtractor(50, 1).extract(broken))
                .isInstanceOf(ExtractionException.class)
                .isNotInstanceOf(ContentNotFoundException.class)
                .hasMessageContaining("broken.pdf");
    }

    @Test
    public void onlyPdfIsSupported() {
        PdfContentExtractor extractor = new PdfContentExtractor(50, 1);

        assertThat(extractor.supports(Path.of("/docs/paper.pdf"))).isTrue();
        assertThat(extractor.supports(Path.of("/docs/notes.txt"))).isFalse();
        assertThatThrownBy(() -> extractor.extract(Files.writeString(tempDir.resolve("notes.txt"), "x")))
                .isInstanceOf(UnsupportedContentTypeException.class);
    }
}

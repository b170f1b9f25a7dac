package com.kmg.extract.service;

import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfTextServiceTest {
    private final PdfTextService service = new PdfTextService();

    @TempDir
    Path tempDir;

    @Test
    void readsTextFromPdf() throws Exception {
        Path pdf = tempDir.resolve("policy.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText("Policy Number:    RGI-12345");
                content.endText();
            }
            document.save(pdf.toFile());
        }

        String text = service.getText(pdf.toString());

        assertThat(text).contains("Policy Number: RGI-12345");
    }

    @Test
    void missingFileIsUnreadable() {
        assertThatThrownBy(() -> service.getText(tempDir.resolve("missing.pdf").toString()))
                .isInstanceOf(ExtractionException.class)
                .extracting(e -> ((ExtractionException) e).kind())
                .isEqualTo(ErrorKind.UNREADABLE);
    }

    @Test
    void corruptFileIsUnreadable() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf at all");

        assertThatThrownBy(() -> service.getText(broken.toString()))
                .isInstanceOf(ExtractionException.class)
                .extracting(e -> ((ExtractionException) e).kind())
                .isEqualTo(ErrorKind.UNREADABLE);
    }

    @Test
    void normalizeCollapsesSpacesAndBlankLines() {
        String text = "Name:\t  RAVI   KUMAR  \r\n\r\n\r\n\r\nCity:  PUNE\n";

        assertThat(PdfTextService.normalize(text)).isEqualTo("Name: RAVI KUMAR\n\nCity: PUNE");
        assertThat(PdfTextService.normalize(null)).isEmpty();
    }
}

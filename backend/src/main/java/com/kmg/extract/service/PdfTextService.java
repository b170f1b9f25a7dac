package com.kmg.extract.service;

import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

@Service
public class PdfTextService implements TextSource {
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    @Override
    public String getText(String sourceRef) {
        Path path = Path.of(sourceRef);
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException(ErrorKind.UNREADABLE, "Document not found: " + path);
        }

        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return normalize(stripper.getText(document));
        } catch (IOException e) {
            throw new ExtractionException(ErrorKind.UNREADABLE, "Failed to read PDF " + path + ": " + e.getMessage(), e);
        }
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            sb.append(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").strip()).append('\n');
        }
        return BLANK_LINES.matcher(sb).replaceAll("\n\n").strip();
    }
}

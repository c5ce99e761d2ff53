package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableList;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * PDFBox based reader. Each page is extracted twice, sorted by position and in content stream
 * order, since annotation labels of scanned maps tend to get lost in one of the two.
 */
public class PdfPageTextReader implements PageTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfPageTextReader.class);
    private static final int LOGGED_CHARS = 500;

    @Override
    public List<String> readPages(File document) throws IOException {
        try (PDDocument pdf = PDDocument.load(document)) {
            PDFTextStripper byPosition = new PDFTextStripper();
            byPosition.setSortByPosition(true);
            PDFTextStripper byStream = new PDFTextStripper();
            byStream.setSortByPosition(false);

            ImmutableList.Builder<String> pages = ImmutableList.builder();
            for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
                String text = pageText(byPosition, pdf, page) + " " + pageText(byStream, pdf, page);
                if (log.isDebugEnabled()) {
                    log.debug("Text of {}, page {}: {}", document.getName(), page,
                            text.length() > LOGGED_CHARS ? text.substring(0, LOGGED_CHARS) : text);
                }
                pages.add(text);
            }
            return pages.build();
        }
    }

    private static String pageText(PDFTextStripper stripper, PDDocument pdf, int page) throws IOException {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(pdf);
    }
}

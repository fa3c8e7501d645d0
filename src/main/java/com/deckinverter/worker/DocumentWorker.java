package com.deckinverter.worker;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;
import com.deckinverter.util.DeckArchives;
import com.deckinverter.util.Diagnostics;
import com.deckinverter.util.ShapeColorRewriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Processes one deck from start to finish: decode the config, load the
 * deck, recolor it slide by slide and save it to new bytes.
 * <p>
 * Every failure at the document boundary (unreadable bytes, a package POI
 * cannot open or save) ends as a failed result; nothing is thrown. Partial
 * edits of a failed deck are discarded with it.
 */
@Slf4j
public class DocumentWorker {

    public ProcessingResult process(DocumentSource document, SerializedConfig serializedConfig) {
        InversionConfig config = serializedConfig.decode();
        String name = document.getName();
        String outputName = DeckArchives.outputName(name, config.getFileSuffix());
        long start = System.currentTimeMillis();

        Diagnostics diagnostics = new Diagnostics();
        byte[] input = document.getData();
        try (XMLSlideShow deck = new XMLSlideShow(new ByteArrayInputStream(input))) {
            List<XSLFSlide> slides = deck.getSlides();
            if (slides.isEmpty()) {
                diagnostics.warn("Presentation has no slides");
            }

            ShapeColorRewriter rewriter = new ShapeColorRewriter(config, diagnostics);
            for (int i = 0; i < slides.size(); i++) {
                diagnostics.setPrefix("Slide " + (i + 1) + ": ");
                log.debug("Processing slide {}/{} of {}", i + 1, slides.size(), name);
                try {
                    rewriter.recolorSlide(slides.get(i));
                } catch (Exception e) {
                    log.warn("Failed to recolor slide {}/{} of {}: {}", i + 1, slides.size(), name, e.getMessage());
                    diagnostics.warn("Slide failed: %s", e.getMessage());
                }
            }
            diagnostics.setPrefix("");

            ByteArrayOutputStream output = new ByteArrayOutputStream(input.length);
            deck.write(output);

            log.info("Processed {} ({} slides, {} warnings) in {} ms",
                    name, slides.size(), diagnostics.size(), System.currentTimeMillis() - start);
            return ProcessingResult.success(name, outputName, output.toByteArray(), diagnostics.getWarnings());
        } catch (Exception e) {
            log.warn("Failed to process {}: {}", name, e.toString());
            return ProcessingResult.failure(name, outputName, "Processing failed: " + describe(e));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

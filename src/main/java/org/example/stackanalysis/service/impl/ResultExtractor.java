package org.example.stackanalysis.service.impl;

import org.example.stackanalysis.model.ResultBlock;
import org.example.stackanalysis.variant.CaptureGrammar;
import org.example.stackanalysis.variant.CaptureGrammar.BlockOpening;
import org.example.stackanalysis.variant.CaptureGrammar.BlockRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the analysis tool's standard output into one result block per image.
 * <p>
 * A single pass with two states. OUTSIDE skips lines until one opens a block.
 * INSIDE appends rows until a line is not a row; that line closes the block and is
 * then looked at again as a possible opening, so back-to-back blocks are not lost.
 * Lines the grammar does not recognise while OUTSIDE are diagnostics and ignored.
 */
@Service
public class ResultExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ResultExtractor.class);

    enum State { OUTSIDE, INSIDE }

    public Map<Long, ResultBlock> extract(Path capture, CaptureGrammar grammar) throws IOException {
        // Malformed bytes decode to U+FFFD.
        try (Reader in = new InputStreamReader(Files.newInputStream(capture), StandardCharsets.UTF_8)) {
            return extract(in, grammar);
        }
    }

    public Map<Long, ResultBlock> extract(Reader input, CaptureGrammar grammar) throws IOException {
        Map<Long, ResultBlock> results = new LinkedHashMap<>();
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);

        State state = State.OUTSIDE;
        OpenBlock block = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (state == State.INSIDE) {
                BlockRow row = grammar.matchRow(line);
                if (row != null) {
                    block.add(row);
                    continue;
                }
                block.closeInto(results);
                block = null;
                state = State.OUTSIDE;
            }
            // OUTSIDE, including the line that just closed a block
            BlockOpening opening = grammar.matchOpening(line);
            if (opening != null) {
                block = new OpenBlock(opening);
                state = State.INSIDE;
            }
        }
        if (state == State.INSIDE) {
            block.closeInto(results);
        }
        return results;
    }

    /**
     * Rows collected since the last opening, grouped by image. Rows without their
     * own image id belong to the opening's image.
     */
    private static class OpenBlock {
        private final BlockOpening opening;
        private final Map<Long, List<String>> rows = new LinkedHashMap<>();

        OpenBlock(BlockOpening opening) {
            this.opening = opening;
        }

        void add(BlockRow row) {
            Long id = row.getImageId() != null ? row.getImageId() : opening.getImageId();
            if (id == null) {
                logger.debug("Row without image ignored: {}", row.getText());
                return;
            }
            rows.computeIfAbsent(id, k -> new ArrayList<>()).add(row.getText());
        }

        void closeInto(Map<Long, ResultBlock> results) {
            rows.forEach((id, lines) -> {
                if (results.put(id, new ResultBlock(id, opening.getSeed(), lines)) != null) {
                    logger.warn("Image {} reported more than once, keeping the last result", id);
                }
            });
        }
    }
}

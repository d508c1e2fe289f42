package org.example.stackanalysis.variant;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Output of the correlation analyser: a stage label naming the exported file,
 * then one row per frame and channel pair, each starting with the frame token.
 *
 * <pre>
 * Reading IFDs
 * Stack correlation (Otsu) : 1851.ome.tif
 * t1,c1,c2,21288,35.06%,0.0682
 * t1,c1,c3,2365,3.89%,0.3988
 * </pre>
 */
public class StageLabelGrammar implements CaptureGrammar {

    private static final Pattern LABEL = Pattern.compile("Stack correlation [^ ]* : (\\d{1,18})\\.ome\\.tif");
    private static final String ROW_PREFIX = "t";

    @Override
    public BlockOpening matchOpening(String line) {
        Matcher m = LABEL.matcher(line);
        return m.lookingAt() ? new BlockOpening(Long.valueOf(m.group(1)), line) : null;
    }

    @Override
    public BlockRow matchRow(String line) {
        return line.startsWith(ROW_PREFIX) ? new BlockRow(null, line) : null;
    }
}
